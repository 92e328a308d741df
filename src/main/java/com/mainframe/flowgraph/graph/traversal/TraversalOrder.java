package com.mainframe.flowgraph.graph.traversal;

import java.util.Iterator;
import java.util.List;

import com.mainframe.flowgraph.model.graph.GraphNode;

import lombok.Getter;

/**
 * A computed forward and reverse node order over one graph.
 *
 * Both orders are immutable lists, so they can be walked any number of times.
 *
 * @param <N> node kind
 */
public final class TraversalOrder<N extends GraphNode> implements Iterable<N> {

    private final List<N> forward;
    private final List<N> reverse;

    /**
     * False when the graph had a cycle and a fallback order was used.
     */
    @Getter
    private final boolean topological;

    TraversalOrder(List<N> forward, List<N> reverse, boolean topological) {
        this.forward = List.copyOf(forward);
        this.reverse = List.copyOf(reverse);
        this.topological = topological;
    }

    public List<N> forward() {
        return forward;
    }

    public List<N> reverse() {
        return reverse;
    }

    public List<String> forwardIds() {
        return forward.stream().map(GraphNode::getId).toList();
    }

    public List<String> reverseIds() {
        return reverse.stream().map(GraphNode::getId).toList();
    }

    public int size() {
        return forward.size();
    }

    @Override
    public Iterator<N> iterator() {
        return forward.iterator();
    }
}
