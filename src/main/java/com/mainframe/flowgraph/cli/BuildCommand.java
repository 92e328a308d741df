package com.mainframe.flowgraph.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.flowgraph.cli.exception.OptionsValidationException;
import com.mainframe.flowgraph.cli.model.BuildOptions;
import com.mainframe.flowgraph.cli.model.ValidatedBuildOptions;
import com.mainframe.flowgraph.cli.output.BuildResultsPrinter;
import com.mainframe.flowgraph.cli.validation.BuildOptionsValidator;
import com.mainframe.flowgraph.graph.FlowGraphEngine;
import com.mainframe.flowgraph.graph.FlowGraphResult;
import com.mainframe.flowgraph.graph.traversal.TraversalOrder;
import com.mainframe.flowgraph.graph.traversal.TraversalProvider;
import com.mainframe.flowgraph.io.GraphJsonExporter;
import com.mainframe.flowgraph.model.core.context.GraphDiagnostics;
import com.mainframe.flowgraph.model.graph.OuterNode;
import com.mainframe.flowgraph.parser.LoadedRecords;
import com.mainframe.flowgraph.parser.RecordJsonParser;
import com.mainframe.flowgraph.parser.RecordLoadingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that loads parser output, builds the graphs and optionally exports them.
 */
@Command(
        name = "build",
        mixinStandardHelpOptions = true,
        version = "legacy-flowgraph 1.0.0",
        description = "Builds the job/step/program graph and per-program paragraph graphs from parsed JCL and COBOL records."
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Mixin
    private BuildOptions options = new BuildOptions();

    private final BuildOptionsValidator validator = new BuildOptionsValidator();
    private final BuildResultsPrinter printer = new BuildResultsPrinter();

    @Override
    public Integer call() {
        ValidatedBuildOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(validated);

        try {
            GraphDiagnostics diagnostics = new GraphDiagnostics();

            log.info("Step 1: Loading records...");
            RecordLoadingService loader = new RecordLoadingService(new RecordJsonParser());
            LoadedRecords records = loader.loadAll(validated.getNormalizedInputDir(), diagnostics);
            if (records.isEmpty()) {
                printer.printFailure("No JSON records found in " + validated.getNormalizedInputDir());
                return 1;
            }

            log.info("Step 2: Building graphs...");
            FlowGraphResult result = new FlowGraphEngine(validated.getConfig())
                    .build(records.getBlocks(), records.getSteps(), diagnostics);

            log.info("Step 3: Computing traversal order...");
            TraversalProvider traversal = new TraversalProvider();
            TraversalOrder<OuterNode> outerOrder = traversal.outerOrder(result.getOuterGraph());

            if (validated.getNormalizedExportFile() != null) {
                log.info("Step 4: Exporting graphs...");
                new GraphJsonExporter(traversal).write(result, validated.getNormalizedExportFile());
            }

            printer.printSuccess(records, result, outerOrder);
            return 0;

        } catch (Exception e) {
            log.error("Build failed with exception", e);
            return 1;
        }
    }

    BuildOptions getOptions() {
        return options;
    }
}
