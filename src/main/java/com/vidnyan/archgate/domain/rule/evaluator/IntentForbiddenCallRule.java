package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.RestrictedCall;
import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Intent must not block, shell out or drive the UI. The adapter marks the calls; this rule
 * reports them for Intent files only.
 */
public class IntentForbiddenCallRule implements Rule {

    private static final String ID = "intent-forbidden-call";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }

    @Override
    public String description() {
        return "Intent must not call APIs its dialect reserves for lower roles";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        if (file.role() != Role.INTENT) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (RestrictedCall call : file.restrictedCalls()) {
            findings.add(finding(file, call.line(), "Intent must not call " + call.api() + ": " + call.reason()));
        }
        return findings;
    }
}
