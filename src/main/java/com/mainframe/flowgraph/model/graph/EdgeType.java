package com.mainframe.flowgraph.model.graph;

/**
 * Edge tags. PERFORM and GOTO only occur inside a program's block graph,
 * EXECUTES and CALL only in the outer graph.
 */
public enum EdgeType {
    /** Block invokes another block and returns. Return is not modeled. */
    PERFORM,
    /** Unconditional transfer between blocks. */
    GOTO,
    /** Job step runs a program. */
    EXECUTES,
    /** Program calls another program. One edge per ordered pair. */
    CALL;

    public boolean isInner() {
        return this == PERFORM || this == GOTO;
    }
}
