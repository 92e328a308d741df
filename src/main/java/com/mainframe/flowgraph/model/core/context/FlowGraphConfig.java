package com.mainframe.flowgraph.model.core.context;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Policy settings for the graph engine.
 */
@Value
@Builder(toBuilder = true)
public class FlowGraphConfig {

    public static final FlowGraphConfig DEFAULTS = FlowGraphConfig.builder().build();

    /**
     * Name of the paragraph every program's control flow starts from.
     */
    @NonNull
    @Builder.Default
    String entryBlockName = "ENTRY";

    /**
     * PERFORM target reported for inline (anonymous) PERFORM ... END-PERFORM.
     * Never turned into an edge.
     */
    @NonNull
    @Builder.Default
    String inlinePerformSentinel = "INLINE";

    /**
     * Separator of composite node ids ({@code program:block}, {@code job:step}).
     * Program ids must not contain it.
     */
    @NonNull
    @Builder.Default
    String idSeparator = ":";

    /**
     * Repeat dead-block removal until nothing changes. Off by default: the
     * standard pass looks at every block once.
     */
    boolean fixedPointDeadBlockElimination;
}
