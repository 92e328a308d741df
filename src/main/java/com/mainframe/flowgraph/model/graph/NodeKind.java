package com.mainframe.flowgraph.model.graph;

/**
 * Kinds of nodes appearing in the outer and inner graphs.
 */
public enum NodeKind {
    JOB,
    STEP,
    PROGRAM,
    BLOCK
}
