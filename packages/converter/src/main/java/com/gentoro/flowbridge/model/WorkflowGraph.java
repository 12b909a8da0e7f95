package com.gentoro.flowbridge.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** A workflow normalized to nodes plus edges, as read from either platform. */
public class WorkflowGraph {
  private final String name;
  private final List<WorkflowNode> nodes;
  private final List<Connection> connections;

  public WorkflowGraph(String name, List<WorkflowNode> nodes, List<Connection> connections) {
    this.name = name;
    this.nodes = List.copyOf(nodes);
    this.connections = List.copyOf(connections);
  }

  public String getName() {
    return name;
  }

  public List<WorkflowNode> getNodes() {
    return nodes;
  }

  public List<Connection> getConnections() {
    return connections;
  }

  public Optional<WorkflowNode> findNode(String id) {
    for (WorkflowNode node : nodes) {
      if (node.getId().equals(id)) return Optional.of(node);
    }
    return Optional.empty();
  }

  /** Upstream node ids of every node, in declared connection order, without duplicates. */
  public Map<String, List<String>> predecessors() {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (Connection c : connections) {
      List<String> list = out.computeIfAbsent(c.toNodeId(), k -> new ArrayList<>());
      if (!list.contains(c.fromNodeId())) {
        list.add(c.fromNodeId());
      }
    }
    return out;
  }
}
