package com.mainframe.flowgraph;

import com.mainframe.flowgraph.cli.BuildCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Legacy Flow Graph builder.
 * This CLI tool turns parsed JCL steps and COBOL paragraphs into a job/step/program
 * graph plus one acyclic paragraph graph per program.
 */
public class FlowGraphApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BuildCommand()).execute(args);
        System.exit(exitCode);
    }
}
