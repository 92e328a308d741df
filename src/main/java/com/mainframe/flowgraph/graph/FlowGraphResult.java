package com.mainframe.flowgraph.graph;

import java.util.Map;
import java.util.Optional;

import com.mainframe.flowgraph.graph.inner.EliminationReport;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.graph.InnerGraph;
import com.mainframe.flowgraph.model.graph.OuterGraph;
import com.mainframe.flowgraph.model.graph.ProgramNode;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of one engine run. The engine does not touch the graphs after handing them out.
 */
@Value
@Builder
public class FlowGraphResult {

    @NonNull
    OuterGraph outerGraph;

    /**
     * Program id to its block graph, in program aggregation order.
     */
    @NonNull
    Map<String, InnerGraph> innerGraphs;

    @NonNull
    Map<String, EliminationReport> eliminationReports;

    @NonNull
    GraphDiagnostics diagnostics;

    public Optional<InnerGraph> findInnerGraph(String programId) {
        return Optional.ofNullable(innerGraphs.get(programId));
    }

    public int totalRemovedBlocks() {
        return eliminationReports.values().stream().mapToInt(r -> r.getRemovedBlocks().size()).sum();
    }

    public int totalRemovedEdges() {
        return eliminationReports.values().stream().mapToInt(r -> r.getRemovedEdges().size()).sum();
    }

    public long placeholderCount() {
        return outerGraph.getPrograms().stream().filter(ProgramNode::isPlaceholder).count();
    }
}
