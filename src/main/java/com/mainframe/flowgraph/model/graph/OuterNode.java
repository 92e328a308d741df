package com.mainframe.flowgraph.model.graph;

/**
 * Base class for nodes of the outer (job / step / program) graph.
 */
public abstract class OuterNode implements GraphNode {

    public abstract <R> R accept(OuterNodeVisitor<R> visitor);
}
