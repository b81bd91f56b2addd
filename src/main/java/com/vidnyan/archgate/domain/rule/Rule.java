package com.vidnyan.archgate.domain.rule;

import com.vidnyan.archgate.domain.model.SourceFile;

import java.util.List;

/**
 * A structural invariant checked file by file over a frozen graph.
 * Implementations are stateless and safe to run concurrently.
 */
public interface Rule {

    /**
     * Stable id used in reports.
     */
    String id();

    Severity severity();

    String description();

    /**
     * Inspect one file of the context's graph.
     */
    List<Finding> inspect(SourceFile file, EvaluationContext context);

    default Finding finding(SourceFile file, int line, String message) {
        return new Finding(id(), severity(), file.path(), line, message);
    }

    /**
     * Get the rule name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
