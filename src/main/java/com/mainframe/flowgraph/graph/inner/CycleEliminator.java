package com.mainframe.flowgraph.graph.inner;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.model.graph.Edge;
import com.mainframe.flowgraph.model.graph.FlowGraph;

/**
 * Turns a graph into a DAG by repeatedly cutting the edge that closes the first cycle found.
 *
 * <p>Each round runs a depth-first search that starts from nodes in ascending
 * id order and follows outgoing edges in insertion order. The first edge
 * leading back to a node still on the search stack is removed, then the
 * search starts over. The result is deterministic but not a minimum
 * feedback arc set.
 */
public class CycleEliminator {
    private static final Logger log = LoggerFactory.getLogger(CycleEliminator.class);

    private enum Mark { UNVISITED, ON_STACK, DONE }

    private static final class Frame {
        final String id;
        final List<Edge> edges;
        int next;

        Frame(String id, List<Edge> edges) {
            this.id = id;
            this.edges = edges;
        }
    }

    /**
     * @return removed edges, in removal order
     */
    public List<Edge> eliminate(FlowGraph<?> graph) {
        List<Edge> removed = new ArrayList<>();
        Edge closing;
        while ((closing = findClosingEdge(graph)) != null) {
            graph.removeEdge(closing);
            removed.add(closing);
        }
        if (!removed.isEmpty()) {
            log.debug("Removed {} edges to break cycles: {}", removed.size(), removed);
        }
        return removed;
    }

    /**
     * @return the edge closing the first cycle reached, or {@code null} if the graph is acyclic
     */
    public Edge findClosingEdge(FlowGraph<?> graph) {
        Map<String, Mark> marks = new HashMap<>();
        for (String root : graph.getNodeIds().stream().sorted().toList()) {
            if (marks.getOrDefault(root, Mark.UNVISITED) == Mark.UNVISITED) {
                Edge closing = visit(graph, root, marks);
                if (closing != null) {
                    return closing;
                }
            }
        }
        return null;
    }

    /**
     * Depth-first search from {@code root} with an explicit stack, so path length is not bounded by the call stack.
     */
    private Edge visit(FlowGraph<?> graph, String root, Map<String, Mark> marks) {
        Deque<Frame> stack = new ArrayDeque<>();
        marks.put(root, Mark.ON_STACK);
        stack.push(new Frame(root, graph.outgoingEdges(root)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next == frame.edges.size()) {
                marks.put(frame.id, Mark.DONE);
                stack.pop();
                continue;
            }
            Edge edge = frame.edges.get(frame.next++);
            String target = edge.getTarget();
            Mark targetMark = marks.getOrDefault(target, Mark.UNVISITED);
            if (targetMark == Mark.ON_STACK) {
                return edge;
            }
            if (targetMark == Mark.UNVISITED) {
                marks.put(target, Mark.ON_STACK);
                stack.push(new Frame(target, graph.outgoingEdges(target)));
            }
        }
        return null;
    }

    public boolean isAcyclic(FlowGraph<?> graph) {
        return findClosingEdge(graph) == null;
    }
}
