package com.mainframe.flowgraph.model.core.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Findings accumulated during one load-and-build run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
public class GraphDiagnostics {
    private final List<Diagnostic> entries = new ArrayList<>();

    public void add(DiagnosticKind kind, String subject, String message) {
        entries.add(new Diagnostic(kind, subject == null ? "" : subject, message));
    }

    public List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.getKind() == kind).toList();
    }

    public long count(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.getKind() == kind).count();
    }

    /**
     * True when anything other than informational notes was recorded.
     */
    public boolean hasIssues() {
        return entries.stream().anyMatch(d -> d.getKind() != DiagnosticKind.INFO);
    }
}
