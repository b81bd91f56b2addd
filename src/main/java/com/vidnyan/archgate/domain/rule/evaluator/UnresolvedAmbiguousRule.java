package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.graph.DependencyEdge;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.Rule;
import com.vidnyan.archgate.domain.rule.Severity;

import java.util.List;
import java.util.stream.Collectors;

public class UnresolvedAmbiguousRule implements Rule {

    private static final String ID = "unresolved-ambiguous";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Severity severity() {
        return Severity.ADVISORY;
    }

    @Override
    public String description() {
        return "Reference matches several in-project files and was not resolved";
    }

    @Override
    public List<Finding> inspect(SourceFile file, EvaluationContext context) {
        return context.graph().outgoing(file.id()).stream()
                .filter(DependencyEdge::isAmbiguous)
                .map(edge -> finding(file, edge.reference().line(),
                        "Reference '" + edge.reference().raw() + "' matches " + edge.candidateIds().size()
                                + " files: " + edge.candidateIds().stream()
                                        .map(id -> context.graph().file(id).path())
                                        .collect(Collectors.joining(", "))))
                .toList();
    }
}
