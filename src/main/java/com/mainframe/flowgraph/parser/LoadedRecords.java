package com.mainframe.flowgraph.parser;

import java.util.List;

import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.model.input.StepRecord;

import lombok.Value;

@Value
public class LoadedRecords {
    List<BlockRecord> blocks;
    List<StepRecord> steps;
    int filesRead;

    public boolean isEmpty() {
        return blocks.isEmpty() && steps.isEmpty();
    }
}
