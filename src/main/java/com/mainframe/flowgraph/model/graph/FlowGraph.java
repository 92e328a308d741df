package com.mainframe.flowgraph.model.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed multi-typed graph keyed by node id.
 *
 * Nodes keep their first insertion position for the lifetime of the graph,
 * even when their attributes are replaced. Outgoing edges of a node keep
 * insertion order. At most one edge exists per (source, target, type).
 *
 * Instances are not thread-safe; a graph has a single writer while it is built.
 *
 * @param <N> node kind stored in this graph
 */
public class FlowGraph<N extends GraphNode> {

    private final Map<String, N> nodes = new LinkedHashMap<>();
    private final Map<String, List<Edge>> outgoing = new HashMap<>();
    private final Map<String, List<Edge>> incoming = new HashMap<>();
    private int edgeCount;

    /**
     * Adds a node, or replaces the attributes of the node already stored under the same id.
     *
     * @return true if the id was not present before
     */
    public boolean addNode(N node) {
        String id = node.getId();
        boolean added = !nodes.containsKey(id);
        nodes.put(id, node);
        if (added) {
            outgoing.put(id, new ArrayList<>());
            incoming.put(id, new ArrayList<>());
        }
        return added;
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<N> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public N getNode(String id) {
        N node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    /**
     * Nodes in insertion order.
     */
    public List<N> getNodes() {
        return List.copyOf(nodes.values());
    }

    public List<String> getNodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Adds an edge unless the same (source, target, type) edge already exists.
     *
     * @return true if the edge was added
     * @throws IllegalArgumentException if either endpoint is not in the graph
     */
    public boolean addEdge(String source, String target, EdgeType type) {
        requireNode(source);
        requireNode(target);
        Edge edge = new Edge(source, target, type);
        List<Edge> out = outgoing.get(source);
        if (out.contains(edge)) {
            return false;
        }
        out.add(edge);
        incoming.get(target).add(edge);
        edgeCount++;
        return true;
    }

    public boolean containsEdge(String source, String target, EdgeType type) {
        List<Edge> out = outgoing.get(source);
        return out != null && out.contains(new Edge(source, target, type));
    }

    /**
     * @throws IllegalArgumentException if the edge is not in the graph
     */
    public void removeEdge(Edge edge) {
        List<Edge> out = outgoing.get(edge.getSource());
        if (out == null || !out.remove(edge)) {
            throw new IllegalArgumentException("Unknown edge: " + edge);
        }
        incoming.get(edge.getTarget()).remove(edge);
        edgeCount--;
    }

    public void removeEdge(String source, String target, EdgeType type) {
        removeEdge(new Edge(source, target, type));
    }

    /**
     * Removes a node together with all of its incoming and outgoing edges.
     *
     * @throws IllegalArgumentException if the node is not in the graph
     */
    public void removeNode(String id) {
        requireNode(id);
        for (Edge edge : outgoing.get(id)) {
            if (!edge.isSelfLoop()) {
                incoming.get(edge.getTarget()).remove(edge);
            }
            edgeCount--;
        }
        for (Edge edge : incoming.get(id)) {
            if (!edge.isSelfLoop()) {
                outgoing.get(edge.getSource()).remove(edge);
                edgeCount--;
            }
        }
        outgoing.remove(id);
        incoming.remove(id);
        nodes.remove(id);
    }

    public List<Edge> outgoingEdges(String id) {
        requireNode(id);
        return Collections.unmodifiableList(outgoing.get(id));
    }

    public List<Edge> incomingEdges(String id) {
        requireNode(id);
        return Collections.unmodifiableList(incoming.get(id));
    }

    /**
     * Distinct successor ids in edge insertion order.
     */
    public List<String> successors(String id) {
        LinkedHashSet<String> result = new LinkedHashSet<>();
        for (Edge edge : outgoingEdges(id)) {
            result.add(edge.getTarget());
        }
        return List.copyOf(result);
    }

    /**
     * Distinct predecessor ids in edge insertion order.
     */
    public List<String> predecessors(String id) {
        LinkedHashSet<String> result = new LinkedHashSet<>();
        for (Edge edge : incomingEdges(id)) {
            result.add(edge.getSource());
        }
        return List.copyOf(result);
    }

    /**
     * Number of incoming edges, counting each edge type separately.
     */
    public int inDegree(String id) {
        return incomingEdges(id).size();
    }

    public int outDegree(String id) {
        return outgoingEdges(id).size();
    }

    /**
     * All edges, grouped by source in node insertion order.
     */
    public List<Edge> getEdges() {
        List<Edge> result = new ArrayList<>(edgeCount);
        for (String id : nodes.keySet()) {
            result.addAll(outgoing.get(id));
        }
        return result;
    }

    /**
     * Copies nodes and edges of this graph into {@code target}, preserving both insertion orders.
     */
    protected <G extends FlowGraph<N>> G copyInto(G target) {
        nodes.values().forEach(target::addNode);
        for (Edge edge : getEdges()) {
            target.addEdge(edge.getSource(), edge.getTarget(), edge.getType());
        }
        return target;
    }

    public FlowGraph<N> copy() {
        return copyInto(new FlowGraph<N>());
    }

    private void requireNode(String id) {
        if (!nodes.containsKey(id)) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[nodes=" + nodes.size() + ", edges=" + edgeCount + "]";
    }
}
