package com.mainframe.flowgraph.model.graph;

import java.util.List;
import java.util.Optional;

/**
 * Cross-entity graph: jobs, steps and programs linked by EXECUTES and CALL edges.
 */
public class OuterGraph extends FlowGraph<OuterNode> {

    public List<ProgramNode> getPrograms() {
        return nodesOfType(ProgramNode.class);
    }

    public List<StepNode> getSteps() {
        return nodesOfType(StepNode.class);
    }

    public List<JobNode> getJobs() {
        return nodesOfType(JobNode.class);
    }

    public Optional<ProgramNode> findProgram(String id) {
        return findNode(id).filter(ProgramNode.class::isInstance).map(ProgramNode.class::cast);
    }

    public Optional<StepNode> findStep(String id) {
        return findNode(id).filter(StepNode.class::isInstance).map(StepNode.class::cast);
    }

    /**
     * Steps belonging to a job, in insertion order.
     */
    public List<StepNode> getStepsOfJob(String jobName) {
        return getSteps().stream()
                .filter(step -> step.getJobName().equals(jobName))
                .toList();
    }

    private <T extends OuterNode> List<T> nodesOfType(Class<T> type) {
        return getNodes().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    @Override
    public OuterGraph copy() {
        return copyInto(new OuterGraph());
    }
}
