package com.mainframe.flowgraph.model.graph;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A JCL job step, keyed by {@code jobName:stepName}.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(callSuper = false)
public class StepNode extends OuterNode {
    @NonNull
    String id;
    @NonNull
    String jobName;
    @NonNull
    String stepName;
    Integer stepNumber;
    /**
     * Program named by the step, {@code null} when the record did not name one.
     */
    String targetUnitId;
    @NonNull
    @Builder.Default
    List<Object> datasets = List.of();
    @NonNull
    @Builder.Default
    String codeWithComments = "";
    @NonNull
    @Builder.Default
    String codeWithoutComments = "";

    @Override
    public NodeKind getKind() {
        return NodeKind.STEP;
    }

    @Override
    public <R> R accept(OuterNodeVisitor<R> visitor) {
        return visitor.visitStep(this);
    }
}
