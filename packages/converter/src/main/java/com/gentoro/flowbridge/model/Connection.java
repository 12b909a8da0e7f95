package com.gentoro.flowbridge.model;

/**
 * Directed edge between two nodes, independent of either platform's native shape.
 *
 * @param fromNodeId id of the producing node
 * @param fromPort output index on the producer (router route index, switch output)
 * @param toNodeId id of the consuming node
 * @param toPort input index on the consumer
 */
public record Connection(String fromNodeId, int fromPort, String toNodeId, int toPort) {

  public Connection withEndpoints(String from, String to) {
    return new Connection(from, fromPort, to, toPort);
  }
}
