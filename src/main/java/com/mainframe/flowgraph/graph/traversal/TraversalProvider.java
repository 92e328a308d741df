package com.mainframe.flowgraph.graph.traversal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.model.graph.BlockNode;
import com.mainframe.flowgraph.model.graph.Edge;
import com.mainframe.flowgraph.model.graph.FlowGraph;
import com.mainframe.flowgraph.model.graph.GraphNode;
import com.mainframe.flowgraph.model.graph.InnerGraph;
import com.mainframe.flowgraph.model.graph.OuterGraph;
import com.mainframe.flowgraph.model.graph.OuterNode;

/**
 * Produces deterministic processing orders over the outer graph and the block graphs.
 *
 * <p>Topological order uses Kahn's algorithm: nodes without predecessors are
 * queued in insertion order, and successors are released in edge insertion
 * order. The reverse order is the topological order reversed.
 *
 * <p>The outer graph may keep cycles (mutually calling programs). In that case
 * the reverse order is all programs in reverse insertion order followed by all
 * steps in reverse insertion order, and the forward order is that sequence
 * reversed. Jobs appear in neither fallback order.
 */
public class TraversalProvider {
    private static final Logger log = LoggerFactory.getLogger(TraversalProvider.class);

    public TraversalOrder<OuterNode> outerOrder(OuterGraph graph) {
        Optional<List<OuterNode>> sorted = topologicalSort(graph);
        if (sorted.isPresent()) {
            log.info("Using topological order with {} nodes", sorted.get().size());
            return new TraversalOrder<>(sorted.get(), reversed(sorted.get()), true);
        }

        log.warn("Outer graph is not a DAG. Using programs then steps in reverse insertion order instead.");
        List<OuterNode> reverse = new ArrayList<>();
        reverse.addAll(reversed(graph.getPrograms()));
        reverse.addAll(reversed(graph.getSteps()));
        log.info("Using fallback order with {} nodes", reverse.size());
        return new TraversalOrder<>(reversed(reverse), reverse, false);
    }

    public TraversalOrder<BlockNode> innerOrder(InnerGraph graph) {
        Optional<List<BlockNode>> sorted = topologicalSort(graph);
        if (sorted.isPresent()) {
            return new TraversalOrder<>(sorted.get(), reversed(sorted.get()), true);
        }
        log.warn("Block graph for {} is not a DAG. Using insertion order.", graph.getProgramId());
        List<BlockNode> nodes = graph.getNodes();
        return new TraversalOrder<>(nodes, reversed(nodes), false);
    }

    /**
     * @return nodes in topological order, or empty if the graph has a cycle
     */
    public <N extends GraphNode> Optional<List<N>> topologicalSort(FlowGraph<N> graph) {
        Map<String, Integer> remaining = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String id : graph.getNodeIds()) {
            int inDegree = graph.inDegree(id);
            remaining.put(id, inDegree);
            if (inDegree == 0) {
                ready.add(id);
            }
        }

        List<N> order = new ArrayList<>(graph.nodeCount());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(graph.getNode(id));
            for (Edge edge : graph.outgoingEdges(id)) {
                int left = remaining.merge(edge.getTarget(), -1, Integer::sum);
                if (left == 0) {
                    ready.add(edge.getTarget());
                }
            }
        }

        if (order.size() < graph.nodeCount()) {
            return Optional.empty();
        }
        return Optional.of(order);
    }

    private static <T> List<T> reversed(List<T> list) {
        List<T> copy = new ArrayList<>(list);
        Collections.reverse(copy);
        return copy;
    }
}
