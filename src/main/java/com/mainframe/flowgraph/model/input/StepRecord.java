package com.mainframe.flowgraph.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One parsed JCL job step.
 *
 * Job and step names are required by the outer graph builder; a record
 * lacking either is skipped there, not here.
 */
@Value
@Builder(toBuilder = true)
public class StepRecord {

    String jobName;

    String stepName;

    Integer stepNumber;

    /**
     * Program executed by the step (EXEC PGM=...).
     */
    String targetUnitId;

    /**
     * DD statements as decoded from the parser document (maps, lists or strings).
     */
    @NonNull
    @Builder.Default
    List<Object> datasets = List.of();

    @NonNull
    @Builder.Default
    String codeWithComments = "";

    @NonNull
    @Builder.Default
    String codeWithoutComments = "";
}
