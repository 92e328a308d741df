package com.mainframe.flowgraph.graph.aggregate;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.ProgramMetadata;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * All blocks of one program, grouped from the raw block records.
 */
@Value
@Builder
public class ProgramUnit {

    @NonNull
    String programId;

    @NonNull
    ProgramMetadata metadata;

    /**
     * Block name to record, in order of first appearance of the name.
     */
    @NonNull
    Map<String, BlockRecord> blocks;

    /**
     * Union of called programs across all blocks, sorted.
     */
    @NonNull
    Set<String> calledUnits;

    /**
     * Blocks ordered for code concatenation: by order hint, missing hints last, then by name.
     */
    @NonNull
    List<BlockRecord> orderedBlocks;

    @NonNull
    String codeWithComments;

    @NonNull
    String codeWithoutComments;

    public int blockCount() {
        return blocks.size();
    }
}
