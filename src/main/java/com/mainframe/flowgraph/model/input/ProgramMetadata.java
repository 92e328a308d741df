package com.mainframe.flowgraph.model.input;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Structural sections of a COBOL program as reported by the source parser.
 *
 * The division contents are opaque to the graph engine; they are carried
 * through to the program node untouched.
 */
@Value
@Builder(toBuilder = true)
public class ProgramMetadata {

    public static final ProgramMetadata EMPTY = ProgramMetadata.builder().build();

    @NonNull
    @Builder.Default
    Map<String, Object> identificationDivision = Map.of();

    @NonNull
    @Builder.Default
    Map<String, Object> environmentDivision = Map.of();

    @NonNull
    @Builder.Default
    Map<String, Object> dataDivision = Map.of();

    /**
     * Parameter names from PROCEDURE DIVISION USING.
     */
    @NonNull
    @Builder.Default
    List<String> procedureDivisionUsing = List.of();

    public boolean isEmpty() {
        return identificationDivision.isEmpty()
                && environmentDivision.isEmpty()
                && dataDivision.isEmpty()
                && procedureDivisionUsing.isEmpty();
    }

    /**
     * Fills every section that is empty here with the same section from {@code other}.
     * Sections already present are never replaced.
     */
    public ProgramMetadata fillMissingFrom(ProgramMetadata other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        return toBuilder()
                .identificationDivision(identificationDivision.isEmpty() ? other.identificationDivision : identificationDivision)
                .environmentDivision(environmentDivision.isEmpty() ? other.environmentDivision : environmentDivision)
                .dataDivision(dataDivision.isEmpty() ? other.dataDivision : dataDivision)
                .procedureDivisionUsing(procedureDivisionUsing.isEmpty() ? other.procedureDivisionUsing : procedureDivisionUsing)
                .build();
    }
}
