package com.mainframe.flowgraph.util;

/**
 * Utility for composing graph node ids.
 *
 * Ids are composed deterministically:
 * - Blocks: {@code PROGRAM + separator + BLOCK}, e.g. PAYROLL:ENTRY
 * - Steps: {@code JOB + separator + STEP}, e.g. NIGHTLY:STEP010
 * - Programs and jobs use their bare names.
 */
public class NodeIdUtil {

    private NodeIdUtil() {
        // Utility class
    }

    public static String blockId(String programId, String blockName, String separator) {
        return programId + separator + blockName;
    }

    public static String stepId(String jobName, String stepName, String separator) {
        return jobName + separator + stepName;
    }

    /**
     * Whether a program id may be used as a node id next to composite block ids.
     */
    public static boolean isValidProgramId(String programId, String separator) {
        return !isBlank(programId) && !programId.contains(separator);
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
