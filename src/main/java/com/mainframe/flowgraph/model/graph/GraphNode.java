package com.mainframe.flowgraph.model.graph;

/**
 * Capability shared by every node kind so that graph containers and
 * traversal can treat them uniformly.
 */
public interface GraphNode {

    String getId();

    NodeKind getKind();
}
