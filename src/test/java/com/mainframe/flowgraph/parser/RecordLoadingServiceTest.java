package com.mainframe.flowgraph.parser;

import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.StepRecord;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for loading records from an input directory.
 */
class RecordLoadingServiceTest {

    @TempDir
    Path inputDir;

    private final RecordLoadingService service = new RecordLoadingService(new RecordJsonParser());
    private final GraphDiagnostics diagnostics = new GraphDiagnostics();

    private Path jclDir;
    private Path cobolDir;

    @BeforeEach
    void setUp() throws IOException {
        jclDir = Files.createDirectories(inputDir.resolve("jcl"));
        cobolDir = Files.createDirectories(inputDir.resolve("cobol"));
    }

    @Test
    void testLoadsStepsAndBlocksInPathOrder() throws IOException {
        Files.writeString(jclDir.resolve("b_step.json"), step("NIGHTLY", "S2", "PGMB"));
        Files.writeString(jclDir.resolve("a_step.json"), step("NIGHTLY", "S1", "PGMA"));

        Path pgmb = Files.createDirectories(cobolDir.resolve("PGMB"));
        Path pgma = Files.createDirectories(cobolDir.resolve("PGMA"));
        Files.writeString(pgmb.resolve("ENTRY.json"), paragraph("PGMB", "ENTRY"));
        Files.writeString(pgma.resolve("WORK.json"), paragraph("PGMA", "WORK"));
        Files.writeString(pgma.resolve("ENTRY.json"), paragraph("PGMA", "ENTRY"));
        Files.writeString(pgma.resolve("notes.txt"), "ignored");

        LoadedRecords records = service.loadAll(inputDir, diagnostics);

        assertThat(records.getFilesRead()).isEqualTo(5);
        assertThat(records.getSteps()).extracting(StepRecord::getStepName).containsExactly("S1", "S2");
        assertThat(records.getBlocks()).extracting(b -> b.getOwnerId() + ":" + b.getBlockName())
                .containsExactly("PGMA:ENTRY", "PGMA:WORK", "PGMB:ENTRY");
        assertThat(diagnostics.getEntries()).isEmpty();
    }

    @Test
    void testArrayDocumentsYieldOneRecordEach() throws IOException {
        Files.writeString(jclDir.resolve("job.json"),
                "[" + step("JOB", "S1", "P1") + "," + step("JOB", "S2", "P2") + "]");

        LoadedRecords records = service.loadAll(inputDir, diagnostics);

        assertThat(records.getSteps()).hasSize(2);
        assertThat(records.getFilesRead()).isEqualTo(1);
    }

    @Test
    void testBadFilesAreReportedAndSkipped() throws IOException {
        Files.writeString(jclDir.resolve("broken.json"), "{ not json");
        Files.writeString(jclDir.resolve("empty.json"), "");
        Files.writeString(jclDir.resolve("scalar.json"), "42");
        Files.writeString(jclDir.resolve("good.json"), step("JOB", "S1", "P1"));

        LoadedRecords records = service.loadAll(inputDir, diagnostics);

        assertThat(records.getSteps()).hasSize(1);
        assertThat(records.getFilesRead()).isEqualTo(1);
        assertThat(diagnostics.count(DiagnosticKind.INPUT_ERROR)).isEqualTo(3);
    }

    @Test
    void testMissingDirectoriesGiveEmptyResult() throws IOException {
        Path empty = Files.createDirectories(inputDir.resolve("nothing-here"));

        LoadedRecords records = service.loadAll(empty, diagnostics);

        assertThat(records.isEmpty()).isTrue();
        assertThat(records.getFilesRead()).isZero();
    }

    @Test
    void testJsonFilesDirectlyUnderCobolAreIgnored() throws IOException {
        Files.writeString(cobolDir.resolve("stray.json"), paragraph("PGM", "ENTRY"));

        LoadedRecords records = service.loadAll(inputDir, diagnostics);

        assertThat(records.getBlocks()).isEmpty();
    }

    @Test
    void testParsedBlockCarriesTargets() throws IOException {
        Path pgm = Files.createDirectories(cobolDir.resolve("PGM"));
        Files.writeString(pgm.resolve("ENTRY.json"), """
            { "program_id": "PGM",
              "procedure_division": { "paragraph": {
                  "paragraph_name": "ENTRY", "perform_targets": ["WORK"], "called_programs": ["SUB"] } } }
            """);

        BlockRecord block = service.loadAll(inputDir, diagnostics).getBlocks().get(0);

        assertThat(block.getPerformTargets()).containsExactly("WORK");
        assertThat(block.getCalledUnits()).containsExactly("SUB");
    }

    static String step(String job, String step, String program) {
        return """
            { "jobName": "%s", "step": { "stepName": "%s", "programId": "%s" } }
            """.formatted(job, step, program);
    }

    static String paragraph(String program, String name) {
        return """
            { "program_id": "%s", "procedure_division": { "paragraph": { "paragraph_name": "%s" } } }
            """.formatted(program, name);
    }
}
