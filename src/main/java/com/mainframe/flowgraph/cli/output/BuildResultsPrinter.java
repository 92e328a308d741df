package com.mainframe.flowgraph.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.cli.model.ValidatedBuildOptions;
import com.mainframe.flowgraph.graph.FlowGraphResult;
import com.mainframe.flowgraph.graph.traversal.TraversalOrder;
import com.mainframe.flowgraph.model.core.context.Diagnostic;
import com.mainframe.flowgraph.model.core.context.DiagnosticKind;
import com.mainframe.flowgraph.model.graph.OuterNode;
import com.mainframe.flowgraph.parser.LoadedRecords;

/**
 * Responsible only for printing CLI output for the "build" command.
 * No validation, no execution.
 */
public class BuildResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(BuildResultsPrinter.class);

    private static final int MAX_LISTED_DIAGNOSTICS = 20;

    public void printBanner(ValidatedBuildOptions v) {
        log.info("=================================================");
        log.info("Legacy Flow Graph Builder");
        log.info("=================================================");
        log.info("Input Directory: {}", v.getNormalizedInputDir());
        log.info("Export File: {}", v.getNormalizedExportFile() != null ? v.getNormalizedExportFile() : "None");
        log.info("Entry Block: {}", v.getConfig().getEntryBlockName());
        log.info("Inline PERFORM Sentinel: {}", v.getConfig().getInlinePerformSentinel());
        log.info("Dead Block Removal: {}", v.getConfig().isFixedPointDeadBlockElimination() ? "fixed point" : "single pass");
        log.info("=================================================");
    }

    public void printSuccess(LoadedRecords records, FlowGraphResult result, TraversalOrder<OuterNode> outerOrder) {
        log.info("");
        log.info("=================================================");
        log.info("BUILD SUCCESSFUL");
        log.info("=================================================");
        log.info("Files Read: {}", records.getFilesRead());
        log.info("Block Records: {}", records.getBlocks().size());
        log.info("Step Records: {}", records.getSteps().size());
        log.info("");
        log.info("Outer Graph:");
        log.info("  Programs: {} ({} placeholders)", result.getOuterGraph().getPrograms().size(), result.placeholderCount());
        log.info("  Jobs: {}", result.getOuterGraph().getJobs().size());
        log.info("  Steps: {}", result.getOuterGraph().getSteps().size());
        log.info("  Edges: {}", result.getOuterGraph().edgeCount());
        log.info("  Traversal: {}", outerOrder.isTopological() ? "topological" : "fallback (cycle detected)");
        log.info("");
        log.info("Block Graphs:");
        log.info("  Programs: {}", result.getInnerGraphs().size());
        log.info("  Dead Blocks Removed: {}", result.totalRemovedBlocks());
        log.info("  Cycle Edges Removed: {}", result.totalRemovedEdges());
        log.info("");
        printDiagnostics(result);
        log.info("=================================================");
    }

    public void printFailure(String message) {
        log.error("Build failed: {}", message);
    }

    private void printDiagnostics(FlowGraphResult result) {
        log.info("Diagnostics:");
        for (DiagnosticKind kind : DiagnosticKind.values()) {
            log.info("  {}: {}", kind, result.getDiagnostics().count(kind));
        }
        int listed = 0;
        for (Diagnostic d : result.getDiagnostics().getEntries()) {
            if (d.getKind() == DiagnosticKind.INFO) {
                continue;
            }
            if (listed++ == MAX_LISTED_DIAGNOSTICS) {
                log.info("  ... (see log for the rest)");
                break;
            }
            log.info("  {}", d);
        }
    }
}
