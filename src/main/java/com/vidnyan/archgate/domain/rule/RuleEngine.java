package com.vidnyan.archgate.domain.rule;

import com.vidnyan.archgate.domain.model.SourceFile;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the rule catalog over a frozen graph.
 * <p>
 * Rules run concurrently, one task per rule. A rule that throws on a file produces an
 * {@link EngineFault} for that (rule, file) pair and moves on to the next file. Findings of
 * all rules are merged and sorted with {@link Finding#ORDER}.
 * </p>
 */
@Slf4j
public class RuleEngine {

    private final List<Rule> rules;
    private final int parallelism;

    public RuleEngine(List<Rule> rules, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        this.rules = List.copyOf(rules);
        this.parallelism = parallelism;
    }

    public List<Rule> rules() {
        return rules;
    }

    public Outcome evaluate(EvaluationContext context) {
        if (rules.isEmpty()) {
            return new Outcome(List.of(), List.of(), List.of());
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, rules.size()));
        try {
            List<Callable<EvaluationResult>> tasks = rules.stream()
                    .<Callable<EvaluationResult>>map(rule -> () -> run(rule, context))
                    .toList();
            List<Future<EvaluationResult>> futures = executor.invokeAll(tasks);

            List<EvaluationResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(collect(rules.get(i), futures.get(i)));
            }
            return Outcome.merge(results);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Rule evaluation interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private EvaluationResult collect(Rule rule, Future<EvaluationResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Rule {} failed: {}", rule.id(), e.getCause().toString());
            return EvaluationResult.fault(rule.id(), String.valueOf(e.getCause()));
        }
    }

    private EvaluationResult run(Rule rule, EvaluationContext context) {
        Instant start = Instant.now();
        List<Finding> findings = new ArrayList<>();
        List<EngineFault> faults = new ArrayList<>();

        for (SourceFile file : context.graph().files()) {
            try {
                findings.addAll(rule.inspect(file, context));
            } catch (RuntimeException e) {
                log.error("Rule {} faulted on {}: {}", rule.id(), file.path(), e.toString());
                faults.add(new EngineFault(rule.id(), file.path(), e.toString()));
            }
        }

        EvaluationResult result = EvaluationResult.of(rule.id(), findings, faults,
                context.graph().files().size(), Duration.between(start, Instant.now()));
        if (result.hasFindings()) {
            log.debug("  {} ({}) found {} findings", rule.id(), rule.getName(), findings.size());
        }
        return result;
    }

    /**
     * Merged outcome of all rules.
     */
    public record Outcome(
        List<EvaluationResult> results,
        List<Finding> findings,
        List<EngineFault> faults
    ) {
        static Outcome merge(List<EvaluationResult> results) {
            List<Finding> findings = new ArrayList<>();
            List<EngineFault> faults = new ArrayList<>();
            for (EvaluationResult result : results) {
                findings.addAll(result.findings());
                faults.addAll(result.faults());
            }
            findings.sort(Finding.ORDER);
            faults.sort(Comparator.comparing(EngineFault::path).thenComparing(EngineFault::ruleId));
            return new Outcome(List.copyOf(results), List.copyOf(findings), List.copyOf(faults));
        }

        public boolean hasFaults() {
            return !faults.isEmpty();
        }

        public long errorCount() {
            return findings.stream().filter(Finding::isError).count();
        }

        public long advisoryCount() {
            return findings.size() - errorCount();
        }
    }
}
