package com.mainframe.flowgraph.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.flowgraph.cli.exception.OptionsValidationException;
import com.mainframe.flowgraph.cli.model.BuildOptions;
import com.mainframe.flowgraph.cli.model.ValidatedBuildOptions;
import com.mainframe.flowgraph.model.core.context.FlowGraphConfig;
import com.mainframe.flowgraph.parser.RecordLoadingService;

public class BuildOptionsValidator {

	public ValidatedBuildOptions validate(BuildOptions o) {
		List<String> errors = new ArrayList<>();

		Path inputDir = null;
		if (o.getInputDir() == null) {
			errors.add("Input directory is required (--input-dir / -i).");
		} else if (!Files.isDirectory(o.getInputDir())) {
			errors.add("Input directory does not exist or is not a directory: " + o.getInputDir());
		} else {
			inputDir = o.getInputDir().toAbsolutePath().normalize();
			if (!Files.isDirectory(inputDir.resolve(RecordLoadingService.JCL_DIR))
					&& !Files.isDirectory(inputDir.resolve(RecordLoadingService.COBOL_DIR))) {
				errors.add("Input directory contains neither a '" + RecordLoadingService.JCL_DIR + "' nor a '"
						+ RecordLoadingService.COBOL_DIR + "' directory: " + inputDir);
			}
		}

		if (isBlank(o.getEntryBlock())) {
			errors.add("Entry block name must not be blank (--entry-block).");
		}
		if (isBlank(o.getInlineSentinel())) {
			errors.add("Inline PERFORM sentinel must not be blank (--inline-sentinel).");
		}

		Path exportFile = null;
		if (o.getExportFile() != null) {
			exportFile = o.getExportFile().toAbsolutePath().normalize();
			if (Files.isDirectory(exportFile)) {
				errors.add("Export target is a directory: " + exportFile);
			} else if (Files.exists(exportFile) && !o.isForce()) {
				errors.add("Export file already exists: " + exportFile + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		FlowGraphConfig config = FlowGraphConfig.builder()
				.entryBlockName(o.getEntryBlock().trim())
				.inlinePerformSentinel(o.getInlineSentinel().trim())
				.fixedPointDeadBlockElimination(o.isFixedPointDeadBlocks())
				.build();

		return new ValidatedBuildOptions(inputDir, exportFile, config);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
