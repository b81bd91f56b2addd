package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.graph.DependencyEdge;
import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Every edge must point into the source role's allowed target set, see {@link DirectionPolicy}.
 */
public class DirectionViolationRule implements Rule {

    private static final String ID = "direction-violation";

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
        return "References must follow the allowed direction between roles";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        if (file.role() == Role.UNCLASSIFIED) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (DependencyEdge edge : context.graph().outgoing(file.id())) {
            List<EdgeTarget> targets = EdgeTarget.of(context.graph(), edge);
            if (targets.isEmpty()) {
                continue;
            }
            List<Optional<String>> verdicts = targets.stream()
                    .map(target -> DirectionPolicy.check(file, target))
                    .toList();
            if (verdicts.stream().allMatch(Optional::isPresent)) {
                String reason = verdicts.get(0).get();
                if (edge.isAmbiguous()) {
                    reason += " (all " + targets.size() + " candidates)";
                }
                findings.add(finding(file, edge.reference().line(), reason + ": " + edge.reference().raw()));
            }
        }
        return findings;
    }
}
