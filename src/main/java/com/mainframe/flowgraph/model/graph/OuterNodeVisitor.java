package com.mainframe.flowgraph.model.graph;

/**
 * Visitor over the outer node kinds.
 */
public interface OuterNodeVisitor<R> {
    R visitJob(JobNode job);
    R visitStep(StepNode step);
    R visitProgram(ProgramNode program);
}
