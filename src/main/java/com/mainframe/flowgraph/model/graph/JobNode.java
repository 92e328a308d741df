package com.mainframe.flowgraph.model.graph;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A JCL job. Steps are not linked to their job by an edge; they carry the
 * job name as an attribute instead.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class JobNode extends OuterNode {
    @NonNull
    String jobName;

    @Override
    public String getId() {
        return jobName;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.JOB;
    }

    @Override
    public <R> R accept(OuterNodeVisitor<R> visitor) {
        return visitor.visitJob(this);
    }
}
