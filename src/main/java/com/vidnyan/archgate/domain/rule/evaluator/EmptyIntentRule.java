package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.List;

/**
 * Flags Intent implementations that make no decision: no branch and at most one call.
 */
public class EmptyIntentRule implements Rule {

    private static final String ID = "empty-intent";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Severity severity() {
        return Severity.ADVISORY;
    }

    @Override
    public String description() {
        return "Intent implementation whose only behavior is a single unconditional delegation";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        StructuralSignals signals = file.signals();
        if (file.role() != Role.INTENT || !signals.implementation() || signals.parseFailure()) {
            return List.of();
        }
        if (signals.branchCount() > 0 || signals.callCount() > 1) {
            return List.of();
        }
        return List.of(finding(file, Finding.NO_LINE, String.format(
                "Intent has %d branch(es) and %d call(s). Verify that domain judgment is present, not just a pass-through",
                signals.branchCount(), signals.callCount())));
    }
}
