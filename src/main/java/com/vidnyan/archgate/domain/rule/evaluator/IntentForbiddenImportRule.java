package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Intent must stay free of I/O and UI namespaces. The namespace list comes from the dialect's adapter.
 */
public class IntentForbiddenImportRule implements Rule {

    private static final String ID = "intent-forbidden-import";

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
        return "Intent must not import namespaces its dialect reserves for lower roles";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        if (file.role() != Role.INTENT || context.forbiddenIntentNamespaces().isEmpty()) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (RawReference reference : file.references()) {
            String imported = reference.raw().toLowerCase(Locale.ROOT);
            for (String namespace : context.forbiddenIntentNamespaces()) {
                String forbidden = namespace.toLowerCase(Locale.ROOT);
                if (imported.equals(forbidden) || imported.startsWith(forbidden + ".")) {
                    findings.add(finding(file, reference.line(),
                            "Intent must not import " + namespace + ": " + reference.raw()));
                    break;
                }
            }
        }
        return findings;
    }
}
