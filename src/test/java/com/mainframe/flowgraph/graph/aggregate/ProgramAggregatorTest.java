package com.mainframe.flowgraph.graph.aggregate;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.core.context.FlowGraphConfig;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.ProgramMetadata;

import static com.mainframe.flowgraph.TestRecords.block;
import static com.mainframe.flowgraph.TestRecords.callingBlock;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for grouping block records into programs.
 */
class ProgramAggregatorTest {

    private final ProgramAggregator aggregator = new ProgramAggregator(FlowGraphConfig.DEFAULTS);
    private final GraphDiagnostics diagnostics = new GraphDiagnostics();

    @Test
    void testGroupsBlocksByProgramInFirstAppearanceOrder() {
        Map<String, ProgramUnit> units = aggregator.aggregate(List.of(
                block("PGMB", "ENTRY"),
                block("PGMA", "ENTRY"),
                block("PGMB", "WORK")), diagnostics);

        assertThat(units.keySet()).containsExactly("PGMB", "PGMA");
        assertThat(units.get("PGMB").getBlocks().keySet()).containsExactly("ENTRY", "WORK");
        assertThat(units.get("PGMA").blockCount()).isEqualTo(1);
    }

    @Test
    void testCallSetIsUnionOfAllBlocks() {
        Map<String, ProgramUnit> units = aggregator.aggregate(List.of(
                callingBlock("PGM", "ENTRY", "SUB1", "SUB2"),
                callingBlock("PGM", "WORK", "SUB2", "SUB3"),
                block("PGM", "DONE")), diagnostics);

        assertThat(units.get("PGM").getCalledUnits()).containsExactlyInAnyOrder("SUB1", "SUB2", "SUB3");
    }

    @Test
    void testConcatenatesCodeByOrderWithMissingOrdersLast() {
        Map<String, ProgramUnit> units = aggregator.aggregate(List.of(
                coded("D", null),
                coded("B", 2),
                coded("C", null),
                coded("A", 1)), diagnostics);

        ProgramUnit unit = units.get("PGM");
        assertThat(unit.getOrderedBlocks()).extracting(BlockRecord::getBlockName)
                .containsExactly("A", "B", "C", "D");
        assertThat(unit.getCodeWithComments()).isEqualTo(
                "--- BLOCK: A ---\n* A\n\n--- BLOCK: B ---\n* B\n\n--- BLOCK: C ---\n* C\n\n--- BLOCK: D ---\n* D");
        assertThat(unit.getCodeWithoutComments()).isEqualTo("A.\nB.\nC.\nD.");
    }

    @Test
    void testDuplicateBlockLastRecordWins() {
        Map<String, ProgramUnit> units = aggregator.aggregate(List.of(
                block("PGM", "ENTRY"),
                block("PGM", "WORK").toBuilder().codeWithComments("first").build(),
                block("PGM", "WORK").toBuilder().codeWithComments("second").build()), diagnostics);

        ProgramUnit unit = units.get("PGM");
        assertThat(unit.getBlocks().keySet()).containsExactly("ENTRY", "WORK");
        assertThat(unit.getBlocks().get("WORK").getCodeWithComments()).isEqualTo("second");
        assertThat(diagnostics.ofKind(DiagnosticKind.STRUCTURAL_AMBIGUITY))
                .singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("WORK"));
    }

    @Test
    void testSkipsRecordsWithoutOwnerOrName() {
        Map<String, ProgramUnit> units = aggregator.aggregate(List.of(
                block(null, "ENTRY"),
                block("PGM", " "),
                block("PGM", "ENTRY")), diagnostics);

        assertThat(units).containsOnlyKeys("PGM");
        assertThat(diagnostics.count(DiagnosticKind.MISSING_REQUIRED_FIELD)).isEqualTo(2);
    }

    @Test
    void testRejectsProgramIdContainingSeparator() {
        Map<String, ProgramUnit> units = aggregator.aggregate(List.of(block("BAD:ID", "ENTRY")), diagnostics);

        assertThat(units).isEmpty();
        assertThat(diagnostics.count(DiagnosticKind.STRUCTURAL_AMBIGUITY)).isEqualTo(1);
    }

    @Test
    void testMetadataTakenFromFirstRecordSupplyingIt() {
        ProgramMetadata withData = ProgramMetadata.builder()
                .dataDivision(Map.of("working_storage", "WS-A"))
                .build();
        ProgramMetadata withUsing = ProgramMetadata.builder()
                .dataDivision(Map.of("working_storage", "IGNORED"))
                .procedureDivisionUsing(List.of("LS-PARM"))
                .build();

        Map<String, ProgramUnit> units = aggregator.aggregate(List.of(
                block("PGM", "ENTRY"),
                block("PGM", "A").toBuilder().metadata(withData).build(),
                block("PGM", "B").toBuilder().metadata(withUsing).build()), diagnostics);

        ProgramMetadata metadata = units.get("PGM").getMetadata();
        assertThat(metadata.getDataDivision()).containsEntry("working_storage", "WS-A");
        assertThat(metadata.getProcedureDivisionUsing()).containsExactly("LS-PARM");
        assertThat(metadata.getIdentificationDivision()).isEmpty();
    }

    @Test
    void testBlankCalleesIgnored() {
        BlockRecord record = block("PGM", "ENTRY").toBuilder().calledUnits(Set.of(" ", "SUB")).build();

        Map<String, ProgramUnit> units = aggregator.aggregate(List.of(record), diagnostics);

        assertThat(units.get("PGM").getCalledUnits()).containsExactly("SUB");
    }

    private static BlockRecord coded(String name, Integer order) {
        return BlockRecord.builder()
                .ownerId("PGM")
                .blockName(name)
                .order(order)
                .codeWithComments("* " + name)
                .codeWithoutComments(name + ".")
                .build();
    }
}
