package com.mainframe.flowgraph.graph.inner;

import java.util.List;

import com.mainframe.flowgraph.model.graph.Edge;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * What the elimination passes removed from one program's block graph.
 */
@Value
@Builder
public class EliminationReport {
    @NonNull
    String programId;
    boolean entryPresent;
    @NonNull
    @Builder.Default
    List<String> removedBlocks = List.of();
    @NonNull
    @Builder.Default
    List<Edge> removedEdges = List.of();
}
