package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.Classification;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.List;

/**
 * Unknown prefixes inside managed folders and files placed outside their role's folder.
 */
public class NamingInvalidRule implements Rule {

    private static final String ID = "naming-invalid";

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
        return "Files must carry a known role prefix and live in their role's folder";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        Classification.NamingIssue issue = file.classification().namingIssue();
        if (issue == null || issue.kind() == Classification.IssueKind.RESERVED_PREFIX) {
            return List.of();
        }
        return List.of(finding(file, Finding.NO_LINE, issue.message()));
    }
}
