package com.vidnyan.archgate.domain.model;

import java.util.List;

/**
 * What a syntax adapter returns for one file.
 *
 * @param references      outbound references in declaration order
 * @param signals         structural signals
 * @param restrictedCalls calls to APIs the dialect reserves for lower roles
 */
public record SyntaxExtraction(
    List<RawReference> references,
    StructuralSignals signals,
    List<RestrictedCall> restrictedCalls
) {

    public SyntaxExtraction {
        references = List.copyOf(references);
        restrictedCalls = List.copyOf(restrictedCalls);
    }

    public SyntaxExtraction(List<RawReference> references, StructuralSignals signals) {
        this(references, signals, List.of());
    }

    /**
     * A failed parse: no references, a parse-failure signal.
     */
    public static SyntaxExtraction failed(String message) {
        return new SyntaxExtraction(List.of(), StructuralSignals.failure(message));
    }
}
