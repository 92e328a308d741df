package com.mainframe.flowgraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.graph.aggregate.ProgramAggregator;
import com.mainframe.flowgraph.graph.aggregate.ProgramUnit;
import com.mainframe.flowgraph.graph.inner.CycleEliminator;
import com.mainframe.flowgraph.graph.inner.DeadBlockEliminator;
import com.mainframe.flowgraph.graph.inner.EliminationReport;
import com.mainframe.flowgraph.graph.inner.InnerGraphBuilder;
import com.mainframe.flowgraph.graph.outer.OuterGraphBuilder;
import com.mainframe.flowgraph.model.core.context.FlowGraphConfig;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.graph.Edge;
import com.mainframe.flowgraph.model.graph.InnerGraph;
import com.mainframe.flowgraph.model.graph.OuterGraph;
import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.StepRecord;

/**
 * Runs the whole construction pipeline for one batch of records.
 *
 * Single-threaded; every call builds fresh graphs and never raises for malformed
 * input. Degradations are reported through {@link GraphDiagnostics}.
 */
public class FlowGraphEngine {
    private static final Logger log = LoggerFactory.getLogger(FlowGraphEngine.class);

    private final ProgramAggregator aggregator;
    private final InnerGraphBuilder innerGraphBuilder;
    private final DeadBlockEliminator deadBlockEliminator;
    private final CycleEliminator cycleEliminator;
    private final OuterGraphBuilder outerGraphBuilder;

    public FlowGraphEngine() {
        this(FlowGraphConfig.DEFAULTS);
    }

    public FlowGraphEngine(FlowGraphConfig config) {
        this.aggregator = new ProgramAggregator(config);
        this.innerGraphBuilder = new InnerGraphBuilder(config);
        this.deadBlockEliminator = new DeadBlockEliminator(config.isFixedPointDeadBlockElimination());
        this.cycleEliminator = new CycleEliminator();
        this.outerGraphBuilder = new OuterGraphBuilder(config);
    }

    public FlowGraphResult build(List<BlockRecord> blocks, List<StepRecord> steps) {
        return build(blocks, steps, new GraphDiagnostics());
    }

    /**
     * @param diagnostics accumulator shared with earlier stages (e.g. record loading)
     */
    public FlowGraphResult build(List<BlockRecord> blocks, List<StepRecord> steps, GraphDiagnostics diagnostics) {
        log.info("Starting to build graphs from {} COBOL block records and {} JCL step records",
                blocks.size(), steps.size());

        // Step 1: group blocks per program
        Map<String, ProgramUnit> units = aggregator.aggregate(blocks, diagnostics);

        // Step 2: block graphs, then dead block and cycle removal per program
        Map<String, InnerGraph> innerGraphs = new LinkedHashMap<>();
        Map<String, EliminationReport> reports = new LinkedHashMap<>();
        for (ProgramUnit unit : units.values()) {
            InnerGraph inner = innerGraphBuilder.build(unit, diagnostics);
            boolean entryPresent = inner.hasEntry();
            List<String> removedBlocks = deadBlockEliminator.eliminate(inner, diagnostics);
            List<Edge> removedEdges = cycleEliminator.eliminate(inner);

            innerGraphs.put(unit.getProgramId(), inner);
            reports.put(unit.getProgramId(), EliminationReport.builder()
                    .programId(unit.getProgramId())
                    .entryPresent(entryPresent)
                    .removedBlocks(List.copyOf(removedBlocks))
                    .removedEdges(List.copyOf(removedEdges))
                    .build());
        }

        // Step 3: jobs, steps, programs and their EXECUTES / CALL edges
        OuterGraph outer = outerGraphBuilder.build(units, steps, diagnostics);

        log.info("Built inner CFGs for {} programs", innerGraphs.size());
        return FlowGraphResult.builder()
                .outerGraph(outer)
                .innerGraphs(Collections.unmodifiableMap(innerGraphs))
                .eliminationReports(Collections.unmodifiableMap(reports))
                .diagnostics(diagnostics)
                .build();
    }
}
