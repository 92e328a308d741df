package com.mainframe.flowgraph.graph.inner;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.graph.aggregate.ProgramUnit;
import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.core.context.FlowGraphConfig;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.graph.BlockNode;
import com.mainframe.flowgraph.model.graph.EdgeType;
import com.mainframe.flowgraph.model.graph.InnerGraph;
import com.mainframe.flowgraph.model.input.BlockRecord;
import com.mainframe.flowgraph.util.NodeIdUtil;

import lombok.RequiredArgsConstructor;

/**
 * Builds the paragraph-level PERFORM / GOTO graph of one program.
 */
@RequiredArgsConstructor
public class InnerGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(InnerGraphBuilder.class);

    private final FlowGraphConfig config;

    public InnerGraph build(ProgramUnit unit, GraphDiagnostics diagnostics) {
        String programId = unit.getProgramId();
        InnerGraph graph = new InnerGraph(programId, blockId(programId, config.getEntryBlockName()));

        for (BlockRecord block : unit.getBlocks().values()) {
            graph.addNode(BlockNode.builder()
                    .id(blockId(programId, block.getBlockName()))
                    .programId(programId)
                    .name(block.getBlockName())
                    .order(block.getOrder())
                    .codeWithComments(block.getCodeWithComments())
                    .codeWithoutComments(block.getCodeWithoutComments())
                    .build());
        }

        for (BlockRecord block : unit.getBlocks().values()) {
            String source = blockId(programId, block.getBlockName());
            addEdges(graph, source, block.getPerformTargets(), EdgeType.PERFORM, diagnostics);
            addEdges(graph, source, block.getGotoTargets(), EdgeType.GOTO, diagnostics);
        }

        log.debug("Built block graph for {}: {} blocks, {} edges", programId, graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private void addEdges(InnerGraph graph, String source, List<String> targets, EdgeType type,
                          GraphDiagnostics diagnostics) {
        for (String target : targets) {
            if (NodeIdUtil.isBlank(target)) {
                continue;
            }
            if (type == EdgeType.PERFORM && target.equals(config.getInlinePerformSentinel())) {
                continue;
            }
            String targetId = blockId(graph.getProgramId(), target);
            if (!graph.containsNode(targetId)) {
                log.warn("{} target {} not found in program {}", type, targetId, graph.getProgramId());
                diagnostics.add(DiagnosticKind.MISSING_REQUIRED_FIELD, source,
                        type + " target '" + target + "' not found in program " + graph.getProgramId());
                continue;
            }
            graph.addEdge(source, targetId, type);
        }
    }

    private String blockId(String programId, String blockName) {
        return NodeIdUtil.blockId(programId, blockName, config.getIdSeparator());
    }
}
