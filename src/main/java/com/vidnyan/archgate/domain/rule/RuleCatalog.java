package com.vidnyan.archgate.domain.rule;

import com.vidnyan.archgate.domain.rule.evaluator.CrossFeatureImportRule;
import com.vidnyan.archgate.domain.rule.evaluator.DependencyPathIncludeRule;
import com.vidnyan.archgate.domain.rule.evaluator.DirectionViolationRule;
import com.vidnyan.archgate.domain.rule.evaluator.EmptyIntentRule;
import com.vidnyan.archgate.domain.rule.evaluator.FatProductionRule;
import com.vidnyan.archgate.domain.rule.evaluator.IntentCapabilityRule;
import com.vidnyan.archgate.domain.rule.evaluator.IntentForbiddenCallRule;
import com.vidnyan.archgate.domain.rule.evaluator.IntentForbiddenImportRule;
import com.vidnyan.archgate.domain.rule.evaluator.LegacyLayoutRule;
import com.vidnyan.archgate.domain.rule.evaluator.NamingInvalidRule;
import com.vidnyan.archgate.domain.rule.evaluator.ParseFailureRule;
import com.vidnyan.archgate.domain.rule.evaluator.ReservedPrefixMisuseRule;
import com.vidnyan.archgate.domain.rule.evaluator.UnresolvedAmbiguousRule;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * The closed rule catalog. There is no way to add, remove or relax rules per run.
 */
public final class RuleCatalog {

    private final List<Rule> rules;

    private RuleCatalog(List<Rule> rules) {
        this.rules = rules;
    }

    public static RuleCatalog standard() {
        return new RuleCatalog(Stream.<Rule>of(
                        new CrossFeatureImportRule(),
                        new DependencyPathIncludeRule(),
                        new DirectionViolationRule(),
                        new IntentCapabilityRule(),
                        new IntentForbiddenCallRule(),
                        new IntentForbiddenImportRule(),
                        new LegacyLayoutRule(),
                        new NamingInvalidRule(),
                        new ParseFailureRule(),
                        new ReservedPrefixMisuseRule(),
                        new EmptyIntentRule(),
                        new FatProductionRule(),
                        new UnresolvedAmbiguousRule())
                .sorted(Comparator.comparing(Rule::id))
                .toList());
    }

    public List<Rule> rules() {
        return rules;
    }
}
