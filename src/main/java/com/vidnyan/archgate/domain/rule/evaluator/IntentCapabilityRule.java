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
import java.util.Set;

/**
 * Intent decides; it never touches Capability, Platform or Resource directly.
 * The contract vocabulary is the one exemption.
 */
public class IntentCapabilityRule implements Rule {

    private static final String ID = "intent-capability-violation";
    private static final Set<Role> LOWER_ROLES = Set.of(Role.CAPABILITY, Role.PLATFORM, Role.RESOURCE);

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
        return "Intent must not reference Capability, Platform or Resource except the contract vocabulary";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        if (file.role() != Role.INTENT) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (DependencyEdge edge : context.graph().outgoing(file.id())) {
            List<EdgeTarget> targets = EdgeTarget.of(context.graph(), edge);
            if (!targets.isEmpty() && targets.stream().allMatch(IntentCapabilityRule::forbidden)) {
                findings.add(finding(file, edge.reference().line(),
                        "Intent must not reference " + targets.get(0).role().displayName() + " directly: "
                                + edge.reference().raw()));
            }
        }
        return findings;
    }

    private static boolean forbidden(EdgeTarget target) {
        return LOWER_ROLES.contains(target.role()) && !target.contractVocabulary();
    }
}
