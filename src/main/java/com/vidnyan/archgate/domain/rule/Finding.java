package com.vidnyan.archgate.domain.rule;

import java.util.Comparator;

/**
 * One reported rule violation.
 *
 * @param ruleId   id of the rule that produced it
 * @param severity severity of that rule
 * @param path     path relative to the scanned root
 * @param line     1-based line, 0 when the finding concerns the whole file
 * @param message  human readable explanation
 */
public record Finding(
    String ruleId,
    Severity severity,
    String path,
    int line,
    String message
) {

    public static final int NO_LINE = 0;

    /**
     * Deterministic report order: path, rule id, line, message.
     */
    public static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::path)
            .thenComparing(Finding::ruleId)
            .thenComparingInt(Finding::line)
            .thenComparing(Finding::message);

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
