package com.mainframe.flowgraph.model.core.context;

import lombok.NonNull;
import lombok.Value;

@Value
public class Diagnostic {
    @NonNull
    DiagnosticKind kind;
    /**
     * Id of the program, step, block or file the finding is about.
     */
    @NonNull
    String subject;
    @NonNull
    String message;

    @Override
    public String toString() {
        return kind + " [" + subject + "] " + message;
    }
}
