package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.Classification;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.List;

public class ReservedPrefixMisuseRule implements Rule {

    private static final String ID = "reserved-prefix-misuse";

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
        return "The layout-only prefix inf_ must not be used as a role prefix";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        Classification.NamingIssue issue = file.classification().namingIssue();
        if (issue == null || issue.kind() != Classification.IssueKind.RESERVED_PREFIX) {
            return List.of();
        }
        return List.of(finding(file, Finding.NO_LINE, issue.message()));
    }
}
