package com.vidnyan.archgate.domain.rule;

import com.vidnyan.archgate.domain.graph.DependencyGraph;

import java.util.List;

/**
 * Context provided to rules.
 *
 * @param graph                     the frozen graph under inspection
 * @param forbiddenIntentNamespaces namespaces the graph's dialect forbids Intent files to import
 */
public record EvaluationContext(
    DependencyGraph graph,
    List<String> forbiddenIntentNamespaces
) {

    public EvaluationContext {
        forbiddenIntentNamespaces = List.copyOf(forbiddenIntentNamespaces);
    }

    public static EvaluationContext of(DependencyGraph graph, List<String> forbiddenIntentNamespaces) {
        return new EvaluationContext(graph, forbiddenIntentNamespaces);
    }
}
