package com.mainframe.flowgraph.model.graph;

import lombok.NonNull;
import lombok.Value;

/**
 * Directed, typed edge. Identity is the (source, target, type) triple.
 */
@Value
public class Edge {
    @NonNull
    String source;
    @NonNull
    String target;
    @NonNull
    EdgeType type;

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    @Override
    public String toString() {
        return source + " -[" + type + "]-> " + target;
    }
}
