package com.mainframe.flowgraph.cli.model;

import java.nio.file.Path;

import com.mainframe.flowgraph.model.core.context.FlowGraphConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps BuildCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedBuildOptions {
    Path normalizedInputDir;
    /**
     * {@code null} when no export was requested.
     */
    Path normalizedExportFile;
    FlowGraphConfig config;
}
