package com.mainframe.flowgraph.graph.outer;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.mainframe.flowgraph.graph.aggregate.ProgramAggregator;
import com.mainframe.flowgraph.graph.aggregate.ProgramUnit;
import com.mainframe.flowgraph.model.core.context.Diagnostic;
import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.core.context.FlowGraphConfig;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.graph.Edge;
import com.mainframe.flowgraph.model.graph.EdgeType;
import com.mainframe.flowgraph.model.graph.JobNode;
import com.mainframe.flowgraph.model.graph.NodeKind;
import com.mainframe.flowgraph.model.graph.OuterGraph;
import com.mainframe.flowgraph.model.graph.ProgramNode;
import com.mainframe.flowgraph.model.graph.StepNode;
import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.StepRecord;

import static com.mainframe.flowgraph.TestRecords.block;
import static com.mainframe.flowgraph.TestRecords.callingBlock;
import static com.mainframe.flowgraph.TestRecords.step;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the job / step / program graph.
 */
class OuterGraphBuilderTest {

    private final FlowGraphConfig config = FlowGraphConfig.DEFAULTS;
    private final GraphDiagnostics diagnostics = new GraphDiagnostics();

    @Test
    void testStepExecutesProgramAndProgramCallsSubprogram() {
        OuterGraph graph = build(
                List.of(callingBlock("P1", "ENTRY", "P2"), block("P2", "ENTRY")),
                List.of(step("J1", "S1", "P1")));

        assertThat(graph.getNodeIds()).containsExactly("P1", "P2", "J1", "J1:S1");
        assertThat(graph.getEdges()).containsExactly(
                new Edge("P1", "P2", EdgeType.CALL),
                new Edge("J1:S1", "P1", EdgeType.EXECUTES));
        assertThat(graph.getNode("J1")).isInstanceOf(JobNode.class);
        assertThat(graph.findProgram("P2").orElseThrow().isPlaceholder()).isFalse();
        assertThat(diagnostics.count(DiagnosticKind.UNRESOLVED_REFERENCE)).isZero();
    }

    @Test
    void testJobIsNotLinkedToItsSteps() {
        OuterGraph graph = build(List.of(), List.of(step("J1", "S1", "P1"), step("J1", "S2", "P1")));

        assertThat(graph.incomingEdges("J1")).isEmpty();
        assertThat(graph.outgoingEdges("J1")).isEmpty();
        assertThat(graph.getJobs()).hasSize(1);
        assertThat(graph.getStepsOfJob("J1")).extracting(StepNode::getStepName).containsExactly("S1", "S2");
    }

    @Test
    void testUnknownProgramsBecomePlaceholders() {
        OuterGraph graph = build(
                List.of(callingBlock("P1", "ENTRY", "EXTERNAL")),
                List.of(step("J1", "S1", "MISSING")));

        ProgramNode external = graph.findProgram("EXTERNAL").orElseThrow();
        assertThat(external.isPlaceholder()).isTrue();
        assertThat(external.hasInnerGraph()).isFalse();
        assertThat(external.getCodeWithComments()).isEmpty();
        assertThat(graph.findProgram("MISSING").orElseThrow().isPlaceholder()).isTrue();
        assertThat(diagnostics.ofKind(DiagnosticKind.UNRESOLVED_REFERENCE))
                .extracting(Diagnostic::getSubject)
                .containsExactly("EXTERNAL", "MISSING");
    }

    @Test
    void testCalleeAggregatedLaterIsAddedWithFullDetails() {
        OuterGraph graph = build(
                List.of(callingBlock("P1", "ENTRY", "P2"),
                        block("P2", "ENTRY").toBuilder().codeWithComments("DISPLAY 'P2'.").build()),
                List.of());

        ProgramNode p2 = graph.findProgram("P2").orElseThrow();
        assertThat(p2.isPlaceholder()).isFalse();
        assertThat(p2.getCodeWithComments()).contains("DISPLAY 'P2'.");
        assertThat(p2.getBlockCount()).isEqualTo(1);
    }

    @Test
    void testCallsAreAddedInSortedCalleeOrder() {
        OuterGraph graph = build(List.of(callingBlock("MAIN", "ENTRY", "ZETA", "ALPHA", "MID")), List.of());

        assertThat(graph.successors("MAIN")).containsExactly("ALPHA", "MID", "ZETA");
    }

    @Test
    void testStepWithoutProgramHasNoExecutesEdge() {
        OuterGraph graph = build(List.of(), List.of(step("J1", "S1", null)));

        assertThat(graph.findStep("J1:S1")).isPresent();
        assertThat(graph.edgeCount()).isZero();
        assertThat(diagnostics.ofKind(DiagnosticKind.MISSING_REQUIRED_FIELD))
                .extracting(Diagnostic::getSubject)
                .containsExactly("J1:S1");
    }

    @Test
    void testStepWithoutJobOrStepNameIsSkipped() {
        OuterGraph graph = build(List.of(), List.of(step(null, "S1", "P1"), step("J1", "", "P1")));

        assertThat(graph.isEmpty()).isTrue();
        assertThat(diagnostics.count(DiagnosticKind.MISSING_REQUIRED_FIELD)).isEqualTo(2);
    }

    @Test
    void testDuplicateStepLastRecordWins() {
        OuterGraph graph = build(List.of(), List.of(step("J1", "S1", "P1"), step("J1", "S1", "P2")));

        assertThat(graph.getSteps()).singleElement()
                .extracting(StepNode::getTargetUnitId).isEqualTo("P2");
        assertThat(diagnostics.count(DiagnosticKind.STRUCTURAL_AMBIGUITY)).isEqualTo(1);
    }

    @Test
    void testProgramReferenceCollidingWithJobIsRejected() {
        OuterGraph graph = build(List.of(), List.of(step("J1", "S1", "J1")));

        assertThat(graph.getNode("J1").getKind()).isEqualTo(NodeKind.JOB);
        assertThat(graph.edgeCount()).isZero();
        assertThat(diagnostics.count(DiagnosticKind.STRUCTURAL_AMBIGUITY)).isEqualTo(1);
    }

    @Test
    void testProgramReferenceWithSeparatorIsRejected() {
        OuterGraph graph = build(List.of(), List.of(step("J1", "S1", "BAD:NAME")));

        assertThat(graph.getPrograms()).isEmpty();
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void testJobOrStepNameWithSeparatorIsRejected() {
        OuterGraph graph = build(List.of(), List.of(
                step("A:B", "C", "P1"),
                step("A", "B:C", "P2"),
                step("A", "S1", "P3")));

        assertThat(graph.getSteps()).extracting(StepNode::getId).containsExactly("A:S1");
        assertThat(graph.getJobs()).extracting(JobNode::getJobName).containsExactly("A");
        assertThat(graph.findProgram("P1")).isEmpty();
        assertThat(graph.findProgram("P2")).isEmpty();
        assertThat(diagnostics.count(DiagnosticKind.STRUCTURAL_AMBIGUITY)).isEqualTo(2);
    }

    @Test
    void testStepDataCarriedOnNode() {
        StepRecord record = step("J1", "S1", "P1").toBuilder()
                .stepNumber(3)
                .datasets(List.of(Map.of("ddName", "IN01")))
                .codeWithComments("//S1 EXEC PGM=P1")
                .build();

        StepNode node = build(List.of(), List.of(record)).findStep("J1:S1").orElseThrow();

        assertThat(node.getStepNumber()).isEqualTo(3);
        assertThat(node.getDatasets()).hasSize(1);
        assertThat(node.getCodeWithComments()).isEqualTo("//S1 EXEC PGM=P1");
    }

    private OuterGraph build(List<BlockRecord> blocks, List<StepRecord> steps) {
        Map<String, ProgramUnit> units = new ProgramAggregator(config).aggregate(blocks, diagnostics);
        return new OuterGraphBuilder(config).build(units, steps, diagnostics);
    }
}
