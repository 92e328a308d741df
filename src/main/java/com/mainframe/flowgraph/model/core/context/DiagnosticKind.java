package com.mainframe.flowgraph.model.core.context;

/**
 * Categories of non-fatal findings recorded while loading records and building graphs.
 */
public enum DiagnosticKind {
    /** A required field is absent or a referenced block does not exist; the node or edge is skipped. */
    MISSING_REQUIRED_FIELD,
    /** Duplicate names, id collisions or malformed ids; resolved by a documented default. */
    STRUCTURAL_AMBIGUITY,
    /** A call or execution target was never aggregated; a placeholder node stands in. */
    UNRESOLVED_REFERENCE,
    /** An input document could not be read or decoded. */
    INPUT_ERROR,
    INFO
}
