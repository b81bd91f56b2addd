package com.vidnyan.archgate.domain.rule;

import java.time.Duration;
import java.util.List;

/**
 * Result of running one rule over a whole graph.
 */
public record EvaluationResult(
    String ruleId,
    EvaluationStatus status,
    List<Finding> findings,
    List<EngineFault> faults,
    int filesInspected,
    Duration executionTime
) {

    public enum EvaluationStatus {
        CLEAN,
        VIOLATION,
        FAULT
    }

    public EvaluationResult {
        findings = List.copyOf(findings);
        faults = List.copyOf(faults);
    }

    /**
     * Result of a run; status follows from what was collected.
     */
    public static EvaluationResult of(String ruleId, List<Finding> findings, List<EngineFault> faults,
                                      int files, Duration duration) {
        EvaluationStatus status = !faults.isEmpty() ? EvaluationStatus.FAULT
                : !findings.isEmpty() ? EvaluationStatus.VIOLATION
                : EvaluationStatus.CLEAN;
        return new EvaluationResult(ruleId, status, findings, faults, files, duration);
    }

    /**
     * A rule that could not run at all.
     */
    public static EvaluationResult fault(String ruleId, String message) {
        return new EvaluationResult(ruleId, EvaluationStatus.FAULT, List.of(),
                List.of(new EngineFault(ruleId, "", message)), 0, Duration.ZERO);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
