package com.mainframe.flowgraph.model.graph;

import com.mainframe.flowgraph.model.input.ProgramMetadata;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A COBOL program in the outer graph.
 *
 * Placeholders stand for programs that are called or executed but for which
 * no block record was ever seen; they carry no code and no inner graph.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(callSuper = false)
public class ProgramNode extends OuterNode {
    @NonNull
    String id;
    @NonNull
    @Builder.Default
    ProgramMetadata metadata = ProgramMetadata.EMPTY;
    @NonNull
    @Builder.Default
    String codeWithComments = "";
    @NonNull
    @Builder.Default
    String codeWithoutComments = "";
    int blockCount;
    boolean placeholder;

    public static ProgramNode placeholder(String id) {
        return ProgramNode.builder().id(id).placeholder(true).build();
    }

    public boolean hasInnerGraph() {
        return blockCount > 0;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROGRAM;
    }

    @Override
    public <R> R accept(OuterNodeVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
