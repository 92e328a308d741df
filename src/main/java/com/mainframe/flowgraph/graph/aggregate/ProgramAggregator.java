package com.mainframe.flowgraph.graph.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.core.context.FlowGraphConfig;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.ProgramMetadata;
import com.mainframe.flowgraph.util.NodeIdUtil;

import lombok.RequiredArgsConstructor;

/**
 * Groups block records by owning program.
 *
 * A later record for the same (program, block) pair replaces the earlier one.
 * Nothing is rejected outright: records without an owner or a block name are
 * skipped and reported.
 */
@RequiredArgsConstructor
public class ProgramAggregator {
    private static final Logger log = LoggerFactory.getLogger(ProgramAggregator.class);

    static final String BLOCK_HEADER_FORMAT = "--- BLOCK: %s ---";

    private static final Comparator<BlockRecord> SOURCE_ORDER = Comparator
            .comparing(BlockRecord::getOrder, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(BlockRecord::getBlockName);

    private final FlowGraphConfig config;

    /**
     * @return program id to aggregated unit, in order of first appearance of the program
     */
    public Map<String, ProgramUnit> aggregate(List<BlockRecord> records, GraphDiagnostics diagnostics) {
        Map<String, Accumulator> byProgram = new LinkedHashMap<>();

        for (BlockRecord record : records) {
            String ownerId = record.getOwnerId();
            if (NodeIdUtil.isBlank(ownerId)) {
                log.warn("Skipping block record without program id (block {})", record.getBlockName());
                diagnostics.add(DiagnosticKind.MISSING_REQUIRED_FIELD, String.valueOf(record.getBlockName()),
                        "Block record has no program id");
                continue;
            }
            if (!NodeIdUtil.isValidProgramId(ownerId, config.getIdSeparator())) {
                log.warn("Skipping block record of program '{}': id contains separator '{}'",
                        ownerId, config.getIdSeparator());
                diagnostics.add(DiagnosticKind.STRUCTURAL_AMBIGUITY, ownerId,
                        "Program id contains the id separator '" + config.getIdSeparator() + "'");
                continue;
            }
            if (NodeIdUtil.isBlank(record.getBlockName())) {
                log.warn("Skipping block record without block name in program {}", ownerId);
                diagnostics.add(DiagnosticKind.MISSING_REQUIRED_FIELD, ownerId, "Block record has no block name");
                continue;
            }

            Accumulator acc = byProgram.computeIfAbsent(ownerId, Accumulator::new);
            acc.metadata = acc.metadata.fillMissingFrom(record.getMetadata());

            BlockRecord previous = acc.blocks.put(record.getBlockName(), record);
            if (previous != null) {
                log.warn("Duplicate block {} in program {}; keeping the last record", record.getBlockName(), ownerId);
                diagnostics.add(DiagnosticKind.STRUCTURAL_AMBIGUITY, ownerId,
                        "Duplicate block '" + record.getBlockName() + "', last record wins");
            }
        }

        Map<String, ProgramUnit> units = new LinkedHashMap<>();
        for (Accumulator acc : byProgram.values()) {
            units.put(acc.programId, toUnit(acc, diagnostics));
        }
        log.info("Aggregated {} block records into {} programs", records.size(), units.size());
        return units;
    }

    private ProgramUnit toUnit(Accumulator acc, GraphDiagnostics diagnostics) {
        Set<String> called = new TreeSet<>();
        for (BlockRecord block : acc.blocks.values()) {
            for (String callee : block.getCalledUnits()) {
                if (!NodeIdUtil.isBlank(callee)) {
                    called.add(callee.trim());
                }
            }
        }

        List<BlockRecord> ordered = new ArrayList<>(acc.blocks.values());
        ordered.sort(SOURCE_ORDER);

        StringBuilder withComments = new StringBuilder();
        StringBuilder withoutComments = new StringBuilder();
        for (BlockRecord block : ordered) {
            if (block.getCodeWithComments().isEmpty() && block.getCodeWithoutComments().isEmpty()) {
                log.debug("Block {} of program {} carries no code", block.getBlockName(), acc.programId);
            }
            withComments.append("\n\n")
                    .append(String.format(BLOCK_HEADER_FORMAT, block.getBlockName()))
                    .append('\n')
                    .append(block.getCodeWithComments());
            withoutComments.append('\n').append(block.getCodeWithoutComments());
        }

        if (acc.metadata.isEmpty()) {
            log.debug("No structural metadata supplied for program {}", acc.programId);
            diagnostics.add(DiagnosticKind.INFO, acc.programId, "No structural metadata supplied");
        }

        return ProgramUnit.builder()
                .programId(acc.programId)
                .metadata(acc.metadata)
                .blocks(Collections.unmodifiableMap(acc.blocks))
                .calledUnits(Collections.unmodifiableSet(called))
                .orderedBlocks(List.copyOf(ordered))
                .codeWithComments(withComments.toString().strip())
                .codeWithoutComments(withoutComments.toString().strip())
                .build();
    }

    private static final class Accumulator {
        final String programId;
        final Map<String, BlockRecord> blocks = new LinkedHashMap<>();
        ProgramMetadata metadata = ProgramMetadata.EMPTY;

        private Accumulator(String programId) {
            this.programId = programId;
        }
    }
}
