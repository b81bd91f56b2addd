package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.LegacyLayout;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.List;

public class LegacyLayoutRule implements Rule {

    private static final String ID = "legacy-layout";

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
        return "Files must not live under deprecated folder shapes";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        LegacyLayout legacy = file.classification().legacyLayout();
        if (legacy == null) {
            return List.of();
        }
        return List.of(finding(file, Finding.NO_LINE,
                "Legacy path '" + legacy.directory() + "/' is deprecated; move to " + legacy.migrationTarget()));
    }
}
