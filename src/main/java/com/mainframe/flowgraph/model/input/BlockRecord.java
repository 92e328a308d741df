package com.mainframe.flowgraph.model.input;

import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One parsed paragraph (block) of a COBOL program.
 *
 * Pure structure only: records arrive from the source parser and are grouped
 * per program by the aggregator.
 */
@Value
@Builder(toBuilder = true)
public class BlockRecord {

    /**
     * Program the block belongs to. Missing owners are reported and skipped.
     */
    String ownerId;

    String blockName;

    /**
     * Position hint within the program source; {@code null} sorts last.
     */
    Integer order;

    @NonNull
    @Builder.Default
    String codeWithComments = "";

    @NonNull
    @Builder.Default
    String codeWithoutComments = "";

    /**
     * PERFORM targets in source order, may contain the inline sentinel.
     */
    @NonNull
    @Builder.Default
    List<String> performTargets = List.of();

    @NonNull
    @Builder.Default
    List<String> gotoTargets = List.of();

    /**
     * Programs invoked with CALL from this block.
     */
    @NonNull
    @Builder.Default
    Set<String> calledUnits = Set.of();

    @NonNull
    @Builder.Default
    ProgramMetadata metadata = ProgramMetadata.EMPTY;
}
