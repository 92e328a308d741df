package com.mainframe.flowgraph.model.graph;

import lombok.Getter;

/**
 * Block-level flow graph of a single program. Edges never leave the program.
 */
@Getter
public class InnerGraph extends FlowGraph<BlockNode> {

    private final String programId;
    private final String entryId;

    public InnerGraph(String programId, String entryId) {
        this.programId = programId;
        this.entryId = entryId;
    }

    public boolean hasEntry() {
        return containsNode(entryId);
    }

    @Override
    public InnerGraph copy() {
        return copyInto(new InnerGraph(programId, entryId));
    }
}
