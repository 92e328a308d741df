package com.mainframe.flowgraph.graph.outer;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.graph.aggregate.ProgramUnit;
import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.core.context.FlowGraphConfig;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.graph.EdgeType;
import com.mainframe.flowgraph.model.graph.JobNode;
import com.mainframe.flowgraph.model.graph.OuterGraph;
import com.mainframe.flowgraph.model.graph.OuterNode;
import com.mainframe.flowgraph.model.graph.ProgramNode;
import com.mainframe.flowgraph.model.graph.StepNode;
import com.mainframe.flowgraph.model.input.StepRecord;
import com.mainframe.flowgraph.util.NodeIdUtil;

import lombok.RequiredArgsConstructor;

/**
 * Builds the job / step / program graph.
 *
 * Works from the aggregated program units directly; the block graphs are not
 * consulted. Programs that are called or executed but never aggregated are
 * represented by placeholder nodes.
 */
@RequiredArgsConstructor
public class OuterGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(OuterGraphBuilder.class);

    private final FlowGraphConfig config;

    public OuterGraph build(Map<String, ProgramUnit> units, List<StepRecord> steps, GraphDiagnostics diagnostics) {
        OuterGraph graph = new OuterGraph();

        for (ProgramUnit unit : units.values()) {
            log.info("Processing COBOL program: {}", unit.getProgramId());
            graph.addNode(toProgramNode(unit));

            if (!unit.getCalledUnits().isEmpty()) {
                log.debug("Program {} calls {} other programs: {}",
                        unit.getProgramId(), unit.getCalledUnits().size(), unit.getCalledUnits());
            }
            for (String callee : unit.getCalledUnits()) {
                if (ensureProgram(graph, callee, units, diagnostics)) {
                    graph.addEdge(unit.getProgramId(), callee, EdgeType.CALL);
                }
            }
        }

        for (StepRecord step : steps) {
            addStep(graph, step, units, diagnostics);
        }

        log.info("Graph building completed. Outer graph has {} nodes and {} edges.",
                graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private void addStep(OuterGraph graph, StepRecord step, Map<String, ProgramUnit> units,
                         GraphDiagnostics diagnostics) {
        String jobName = step.getJobName();
        String stepName = step.getStepName();
        if (NodeIdUtil.isBlank(jobName) || NodeIdUtil.isBlank(stepName)) {
            log.warn("Skipping JCL step due to missing job name or step name: {}", step);
            diagnostics.add(DiagnosticKind.MISSING_REQUIRED_FIELD,
                    NodeIdUtil.isBlank(jobName) ? String.valueOf(stepName) : jobName,
                    "Step record lacks job name or step name");
            return;
        }

        String separator = config.getIdSeparator();
        if (jobName.contains(separator) || stepName.contains(separator)) {
            log.warn("Skipping JCL step {}/{}: name contains separator '{}'", jobName, stepName, separator);
            diagnostics.add(DiagnosticKind.STRUCTURAL_AMBIGUITY, jobName + "/" + stepName,
                    "Job or step name contains the id separator '" + separator + "'");
            return;
        }

        String stepId = NodeIdUtil.stepId(jobName, stepName, separator);
        log.info("Processing JCL job step: {}", stepId);

        Optional<OuterNode> existingJob = graph.findNode(jobName);
        if (existingJob.isEmpty()) {
            graph.addNode(new JobNode(jobName));
            log.debug("Added JCL job node: {}", jobName);
        } else if (!(existingJob.get() instanceof JobNode)) {
            log.warn("Job name {} collides with an existing {} node", jobName, existingJob.get().getKind());
            diagnostics.add(DiagnosticKind.STRUCTURAL_AMBIGUITY, jobName,
                    "Job name collides with an existing " + existingJob.get().getKind() + " node; no job node added");
        }

        if (graph.findStep(stepId).isPresent()) {
            log.warn("Duplicate JCL step {}; keeping the last record", stepId);
            diagnostics.add(DiagnosticKind.STRUCTURAL_AMBIGUITY, stepId, "Duplicate step, last record wins");
        }
        graph.addNode(StepNode.builder()
                .id(stepId)
                .jobName(jobName)
                .stepName(stepName)
                .stepNumber(step.getStepNumber())
                .targetUnitId(step.getTargetUnitId())
                .datasets(step.getDatasets())
                .codeWithComments(step.getCodeWithComments())
                .codeWithoutComments(step.getCodeWithoutComments())
                .build());

        String target = step.getTargetUnitId();
        if (NodeIdUtil.isBlank(target)) {
            log.warn("JCL step {} names no program; no EXECUTES edge added", stepId);
            diagnostics.add(DiagnosticKind.MISSING_REQUIRED_FIELD, stepId, "Step names no program to execute");
            return;
        }
        if (ensureProgram(graph, target, units, diagnostics)) {
            graph.addEdge(stepId, target, EdgeType.EXECUTES);
        }
    }

    /**
     * Makes sure a program node exists for {@code programId}.
     *
     * @return false if the id cannot be used as a program node
     */
    private boolean ensureProgram(OuterGraph graph, String programId, Map<String, ProgramUnit> units,
                                  GraphDiagnostics diagnostics) {
        Optional<OuterNode> existing = graph.findNode(programId);
        if (existing.isPresent()) {
            if (existing.get() instanceof ProgramNode) {
                return true;
            }
            log.warn("Program reference {} collides with an existing {} node", programId, existing.get().getKind());
            diagnostics.add(DiagnosticKind.STRUCTURAL_AMBIGUITY, programId,
                    "Program reference collides with an existing " + existing.get().getKind() + " node");
            return false;
        }
        if (!NodeIdUtil.isValidProgramId(programId, config.getIdSeparator())) {
            log.warn("Ignoring program reference '{}': id contains separator '{}'", programId, config.getIdSeparator());
            diagnostics.add(DiagnosticKind.STRUCTURAL_AMBIGUITY, programId,
                    "Program id contains the id separator '" + config.getIdSeparator() + "'");
            return false;
        }

        ProgramUnit unit = units.get(programId);
        if (unit != null) {
            graph.addNode(toProgramNode(unit));
        } else {
            log.debug("Program {} was never aggregated; adding placeholder", programId);
            diagnostics.add(DiagnosticKind.UNRESOLVED_REFERENCE, programId,
                    "Referenced program has no block records; placeholder added");
            graph.addNode(ProgramNode.placeholder(programId));
        }
        return true;
    }

    private ProgramNode toProgramNode(ProgramUnit unit) {
        return ProgramNode.builder()
                .id(unit.getProgramId())
                .metadata(unit.getMetadata())
                .codeWithComments(unit.getCodeWithComments())
                .codeWithoutComments(unit.getCodeWithoutComments())
                .blockCount(unit.blockCount())
                .placeholder(false)
                .build();
    }
}
