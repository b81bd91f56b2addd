package com.vidnyan.archgate.domain.model;

import lombok.Builder;

/**
 * Syntactic counters an adapter extracts from one file.
 * Only code inside bodies is counted; comments and string contents are ignored.
 */
@Builder
public record StructuralSignals(
    boolean implementation,
    int codeLines,
    int branchCount,
    int callCount,
    int externalFieldAccessCount,
    int domainConditionalCount,
    boolean parseFailure,
    String parseError
) {

    public static StructuralSignals empty() {
        return new StructuralSignals(false, 0, 0, 0, 0, 0, false, null);
    }

    public static StructuralSignals failure(String message) {
        return new StructuralSignals(false, 0, 0, 0, 0, 0, true, message);
    }

    /**
     * Branch points per code line, 0 when there is no code.
     */
    public double conditionalDensity() {
        return codeLines == 0 ? 0.0 : (double) branchCount / codeLines;
    }
}
