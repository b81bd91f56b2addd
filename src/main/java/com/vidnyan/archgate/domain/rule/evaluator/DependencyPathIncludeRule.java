package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Feature roles reach dependencies through Capability, never by dependency repository path.
 */
public class DependencyPathIncludeRule implements Rule {

    private static final String ID = "dependency-path-include";
    private static final Pattern DEPS_SEGMENT = Pattern.compile("(^|[\\\\/])deps([\\\\/]|$)");

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
        return "Intent, Interpretation and Production must not reference deps/ paths directly";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        if (!file.role().isFeatureScoped()) {
            return List.of();
        }
        return file.references().stream()
                .filter(reference -> !reference.system())
                .filter(reference -> DEPS_SEGMENT.matcher(reference.raw()).find())
                .map(reference -> finding(file, reference.line(), message(reference)))
                .toList();
    }

    private static String message(RawReference reference) {
        return "Do not reference dependency repository paths directly from feature roles: " + reference.raw();
    }
}
