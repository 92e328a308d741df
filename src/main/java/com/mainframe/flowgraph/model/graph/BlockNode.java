package com.mainframe.flowgraph.model.graph;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A paragraph inside one program's block graph, keyed by {@code programId:blockName}.
 */
@Value
@Builder(toBuilder = true)
public class BlockNode implements GraphNode {
    @NonNull
    String id;
    @NonNull
    String programId;
    @NonNull
    String name;
    Integer order;
    @NonNull
    @Builder.Default
    String codeWithComments = "";
    @NonNull
    @Builder.Default
    String codeWithoutComments = "";

    @Override
    public NodeKind getKind() {
        return NodeKind.BLOCK;
    }
}
