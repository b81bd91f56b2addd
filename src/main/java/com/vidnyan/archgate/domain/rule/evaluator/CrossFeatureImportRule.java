package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.graph.DependencyEdge;
import com.vidnyan.archgate.domain.graph.Resolution;
import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Features are isolated: a file of one feature must not reference a file of another.
 * DataPlane targets and the contract vocabulary are the permitted shared channels.
 * Only in-project targets are considered; an ambiguous reference is reported only when
 * every candidate belongs to another feature.
 */
public class CrossFeatureImportRule implements Rule {

    private static final String ID = "cross-feature-import";

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
        return "Files must not reference files of another feature except through DataPlane";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        if (!file.classification().hasFeature()) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (DependencyEdge edge : context.graph().outgoing(file.id())) {
            if (edge.resolution() == Resolution.EXTERNAL) {
                continue;
            }
            List<EdgeTarget> targets = EdgeTarget.of(context.graph(), edge);
            if (!targets.isEmpty() && targets.stream().allMatch(target -> crosses(file, target))) {
                findings.add(finding(file, edge.reference().line(),
                        "Reference to " + targets.get(0).describe() + " crosses feature boundary from '"
                                + file.feature() + "': " + edge.reference().raw()));
            }
        }
        return findings;
    }

    private static boolean crosses(SourceFile file, EdgeTarget target) {
        return target.role() != Role.DATA_PLANE
                && !target.contractVocabulary()
                && !target.feature().isEmpty()
                && !target.feature().equalsIgnoreCase(file.feature());
    }
}
