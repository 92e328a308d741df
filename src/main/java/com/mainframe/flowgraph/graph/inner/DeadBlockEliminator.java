package com.mainframe.flowgraph.graph.inner;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.graph.InnerGraph;

/**
 * Removes blocks that nothing transfers control to.
 *
 * <p>One pass visits every block once, in insertion order, and removes it if
 * its in-degree is zero at that moment. A block whose only predecessor is
 * removed later in the same pass survives the pass. With {@code fixedPoint}
 * the pass is repeated until it removes nothing.
 *
 * <p>Graphs without an entry block are left untouched.
 */
public class DeadBlockEliminator {
    private static final Logger log = LoggerFactory.getLogger(DeadBlockEliminator.class);

    private final boolean fixedPoint;

    public DeadBlockEliminator(boolean fixedPoint) {
        this.fixedPoint = fixedPoint;
    }

    /**
     * @return ids of removed blocks, in removal order
     */
    public List<String> eliminate(InnerGraph graph, GraphDiagnostics diagnostics) {
        String entry = graph.getEntryId();
        if (!graph.hasEntry()) {
            log.warn("ENTRY paragraph {} not found for program {}. Skipping dead code removal.",
                    entry, graph.getProgramId());
            diagnostics.add(DiagnosticKind.STRUCTURAL_AMBIGUITY, graph.getProgramId(),
                    "No entry block " + entry + "; dead block removal skipped");
            return List.of();
        }

        List<String> removed = new ArrayList<>();
        int removedInPass;
        do {
            removedInPass = singlePass(graph, entry, removed);
        } while (fixedPoint && removedInPass > 0);

        if (!removed.isEmpty()) {
            log.debug("Removed {} dead blocks from program {}: {}", removed.size(), graph.getProgramId(), removed);
        }
        return removed;
    }

    private int singlePass(InnerGraph graph, String entry, List<String> removed) {
        int count = 0;
        for (String id : graph.getNodeIds()) {
            if (!id.equals(entry) && graph.inDegree(id) == 0) {
                graph.removeNode(id);
                removed.add(id);
                count++;
            }
        }
        return count;
    }
}
