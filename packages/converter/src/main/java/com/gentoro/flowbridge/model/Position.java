package com.gentoro.flowbridge.model;

/** Canvas coordinates of a node. */
public record Position(double x, double y) {}
