package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.List;

/**
 * A file that could not be read or parsed cannot be checked, which blocks the gate.
 */
public class ParseFailureRule implements Rule {

    private static final String ID = "parse-failure";

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
        return "Every in-scope file must be readable and parsable";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        if (!file.signals().parseFailure()) {
            return List.of();
        }
        return List.of(finding(file, Finding.NO_LINE, "Failed to read or parse file: " + file.signals().parseError()));
    }
}
