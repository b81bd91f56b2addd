package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags Production implementations that appear to make domain decisions.
 */
public class FatProductionRule implements Rule {

    private static final String ID = "fat-production";

    static final double MAX_CONDITIONAL_DENSITY = 0.25;
    static final int MIN_CODE_LINES = 4;

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
        return "Production implementation with dense or domain-meaningful conditionals";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        StructuralSignals signals = file.signals();
        if (file.role() != Role.PRODUCTION || !signals.implementation() || signals.parseFailure()) {
            return List.of();
        }

        List<String> reasons = new ArrayList<>();
        if (signals.domainConditionalCount() > 0) {
            reasons.add(signals.domainConditionalCount() + " domain-meaningful conditional(s)");
        }
        if (signals.codeLines() >= MIN_CODE_LINES && signals.conditionalDensity() > MAX_CONDITIONAL_DENSITY) {
            reasons.add(String.format(Locale.ROOT, "conditional density %.2f over %d code lines",
                    signals.conditionalDensity(), signals.codeLines()));
        }
        if (signals.externalFieldAccessCount() > 0) {
            reasons.add(signals.externalFieldAccessCount() + " field access(es) inside branch conditions");
        }

        if (reasons.isEmpty()) {
            return List.of();
        }
        return List.of(finding(file, Finding.NO_LINE,
                "Production contains " + String.join(", ", reasons) + ". Consider moving domain logic to Intent or Interpretation"));
    }
}
