package com.mainframe.flowgraph.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "build" command. No validation, no execution
 * logic, no printing.
 */
@Getter
@Setter
public class BuildOptions {

	@Option(names = { "--input-dir",
			"-i" }, description = "Directory holding parser output: jcl/*.json and cobol/<program>/*.json")
	private Path inputDir;

	@Option(names = { "--export", "-o" }, description = "Write the built graphs to this JSON file")
	private Path exportFile;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing export file")
	private boolean force;

	@Option(names = {
			"--entry-block" }, defaultValue = "ENTRY", description = "Paragraph every program starts from (default: ENTRY)")
	private String entryBlock;

	@Option(names = {
			"--inline-sentinel" }, defaultValue = "INLINE", description = "PERFORM target used for inline PERFORM blocks (default: INLINE)")
	private String inlineSentinel;

	@Option(names = {
			"--fixed-point-dead-blocks" }, description = "Repeat dead paragraph removal until nothing changes")
	private boolean fixedPointDeadBlocks;

}
