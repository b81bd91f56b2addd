package com.vidnyan.archgate.application.service;

import com.vidnyan.archgate.application.port.in.GateConfigurationException;
import com.vidnyan.archgate.application.port.in.RunGateUseCase;
import com.vidnyan.archgate.application.port.out.ReportWriter;
import com.vidnyan.archgate.application.port.out.SyntaxAdapter;
import com.vidnyan.archgate.domain.graph.DependencyGraph;
import com.vidnyan.archgate.domain.rule.EngineFault;
import com.vidnyan.archgate.domain.rule.EvaluationContext;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.rule.RuleEngine;
import com.vidnyan.archgate.domain.rule.Severity;
import com.vidnyan.archgate.domain.stage.GateReport;
import com.vidnyan.archgate.domain.stage.Stage;
import com.vidnyan.archgate.domain.stage.StageExecution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs the gate: the documentation stage, then one code stage per dialect found in each code root.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GateOrchestrator implements RunGateUseCase {

    public static final String DOCS_STAGE = "docs";
    public static final String CODE_STAGE = "code";
    public static final String SOURCE_FILES_MISSING = "source-files-missing";

    private final SyntaxAdapterRegistry registry;
    private final SourceModelBuilder sourceModelBuilder;
    private final RuleEngine ruleEngine;
    private final DocumentationHygieneChecker documentationChecker;
    private final ReportWriter reportWriter;
    private final Clock clock;

    @Override
    public GateReport run(GateRequest request) {
        ResolvedRequest resolved = validate(request);
        Instant generatedAt = Instant.now(clock);
        log.info("Starting gate run over: {}", resolved.repoRoot());

        List<Stage> stages = new ArrayList<>();

        // Step 1: Documentation hygiene
        log.info("Step 1: Documentation stage...");
        stages.add(runDocsStage(resolved, request));

        // Step 2: Code architecture, one stage per dialect and root
        log.info("Step 2: Code stages...");
        if (request.skipCode()) {
            stages.add(skipped(CODE_STAGE, "Skipped by flag"));
        } else if (resolved.codeRoots().isEmpty()) {
            stages.add(skipped(CODE_STAGE, "Code root not provided/found; skipped code architecture stage"));
        } else {
            boolean labelled = resolved.codeRoots().size() > 1;
            for (Path codeRoot : resolved.codeRoots()) {
                String suffix = labelled ? ":" + label(resolved.repoRoot(), codeRoot) : "";
                stages.addAll(runCodeStages(resolved.repoRoot(), codeRoot, suffix, request));
            }
        }

        // Step 3: Artifacts and report
        log.info("Step 3: Writing report...");
        Path reportDir = resolved.reportPath().getParent();
        List<Stage> written = new ArrayList<>();
        Set<String> artifactNames = new HashSet<>();
        for (Stage stage : stages) {
            if (stage.isSkipped()) {
                written.add(stage);
                continue;
            }
            Path artifact = reportDir.resolve(artifactFileName(stage.name(), artifactNames));
            Stage withPath = stage.withOutputPath(artifact.toString());
            reportWriter.writeStageArtifact(artifact, withPath, generatedAt);
            written.add(withPath);
        }

        GateReport report = GateReport.aggregate(generatedAt, resolved.repoRoot().toString(), written);
        reportWriter.writeReport(resolved.reportPath(), report);

        log.info("Gate {}: {} stages, report at {}", report.gatePassed() ? "PASSED" : "FAILED",
                written.size(), resolved.reportPath());
        return report;
    }

    private Stage runDocsStage(ResolvedRequest resolved, GateRequest request) {
        if (request.skipDocs()) {
            return skipped(DOCS_STAGE, "Skipped by flag");
        }
        if (resolved.docRoot() == null) {
            return skipped(DOCS_STAGE, "Documentation root not configured");
        }

        StageExecution execution = new StageExecution(DOCS_STAGE,
                label(resolved.repoRoot(), resolved.docRoot()), null);
        execution.start();
        try {
            DocumentationHygieneChecker.DocCheck check = documentationChecker.check(resolved.docRoot());
            execution.complete(check.filesScanned(), check.findings(), List.of(),
                    check.filesScanned() + " documents, " + check.findings().size() + " issues");
        } catch (RuntimeException e) {
            log.error("Documentation stage failed: {}", e.toString());
            execution.abort(new EngineFault(DOCS_STAGE, "", e.toString()));
        }
        return logged(execution.toStage());
    }

    private List<Stage> runCodeStages(Path repoRoot, Path codeRoot, String suffix, GateRequest request) {
        String rootLabel = label(repoRoot, codeRoot);
        Map<String, List<Path>> byDialect;
        try {
            byDialect = sourceModelBuilder.partitionByDialect(codeRoot);
        } catch (IOException | RuntimeException e) {
            log.error("Cannot enumerate {}: {}", codeRoot, e.toString());
            StageExecution execution = new StageExecution(CODE_STAGE + suffix, rootLabel, null);
            execution.start();
            execution.abort(new EngineFault(CODE_STAGE, "", e.toString()));
            return List.of(logged(execution.toStage()));
        }

        if (byDialect.isEmpty()) {
            StageExecution execution = new StageExecution(CODE_STAGE + suffix, rootLabel, null);
            execution.start();
            execution.complete(0, List.of(new Finding(SOURCE_FILES_MISSING, Severity.ERROR, ".", Finding.NO_LINE,
                    "No source files of any registered dialect under " + rootLabel)), List.of(),
                    "No source files found");
            return List.of(logged(execution.toStage()));
        }

        List<Stage> stages = new ArrayList<>();
        for (Map.Entry<String, List<Path>> entry : byDialect.entrySet()) {
            String dialect = entry.getKey();
            String name = CODE_STAGE + "-" + dialect + suffix;
            if (request.skipDialects().contains(dialect)) {
                stages.add(skipped(name, "Dialect skipped by flag"));
                continue;
            }

            StageExecution execution = new StageExecution(name, rootLabel, dialect);
            execution.start();
            try {
                SyntaxAdapter adapter = registry.forDialect(dialect).orElseThrow();
                DependencyGraph graph = sourceModelBuilder.build(codeRoot, dialect, entry.getValue());
                DependencyGraph.GraphStats stats = graph.stats();
                log.info("  Built {}: {} files, {} edges", name, stats.fileCount(), stats.edgeCount());

                RuleEngine.Outcome outcome = ruleEngine.evaluate(
                        EvaluationContext.of(graph, adapter.forbiddenIntentNamespaces()));
                execution.complete(stats.fileCount(), outcome.findings(), outcome.faults(), String.format(Locale.ROOT,
                        "%d files, %d edges (%d resolved, %d external, %d ambiguous)",
                        stats.fileCount(), stats.edgeCount(), stats.resolved(), stats.external(), stats.ambiguous()));
            } catch (RuntimeException e) {
                log.error("Stage {} failed: {}", name, e.toString());
                execution.abort(new EngineFault(CODE_STAGE, "", e.toString()));
            }
            stages.add(logged(execution.toStage()));
        }
        return stages;
    }

    private ResolvedRequest validate(GateRequest request) {
        if (request.repoRoot() == null || !Files.isDirectory(request.repoRoot())) {
            throw new GateConfigurationException("Repository root not found: " + request.repoRoot());
        }
        if (request.reportPath() == null) {
            throw new GateConfigurationException("Report path is required");
        }
        Path repoRoot = request.repoRoot().toAbsolutePath().normalize();

        List<Path> codeRoots = new ArrayList<>();
        for (Path codeRoot : request.codeRoots()) {
            Path resolved = repoRoot.resolve(codeRoot).normalize();
            if (!Files.isDirectory(resolved)) {
                throw new GateConfigurationException("Code root not found: " + resolved);
            }
            codeRoots.add(resolved);
        }

        Path docRoot = null;
        if (request.docRoot() != null) {
            docRoot = repoRoot.resolve(request.docRoot()).normalize();
            if (!Files.isDirectory(docRoot)) {
                throw new GateConfigurationException("Documentation root not found: " + docRoot);
            }
        }
        return new ResolvedRequest(repoRoot, codeRoots, docRoot, repoRoot.resolve(request.reportPath()).normalize());
    }

    private static Stage skipped(String name, String reason) {
        StageExecution execution = new StageExecution(name, null, null);
        execution.skip(reason);
        log.info("  {} skipped: {}", name, reason);
        return execution.toStage();
    }

    private static Stage logged(Stage stage) {
        log.info("  {} {}: {} errors, {} advisories ({})", stage.name(), stage.status(),
                stage.errorCount(), stage.advisoryCount(), stage.note());
        return stage;
    }

    static String label(Path repoRoot, Path root) {
        String label = root.startsWith(repoRoot) ? repoRoot.relativize(root).toString() : root.toString();
        label = label.replace('\\', '/');
        return label.isEmpty() ? "." : label;
    }

    static String sanitize(String stageName) {
        return stageName.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    /**
     * Artifact file name for a stage, suffixed with an index when an earlier stage of this run
     * already sanitized to the same name. Compared case-insensitively.
     */
    static String artifactFileName(String stageName, Set<String> taken) {
        String base = "archgate-" + sanitize(stageName);
        String candidate = base + ".json";
        for (int index = 2; !taken.add(candidate.toLowerCase(Locale.ROOT)); index++) {
            candidate = base + "-" + index + ".json";
        }
        return candidate;
    }

    private record ResolvedRequest(Path repoRoot, List<Path> codeRoots, Path docRoot, Path reportPath) {}
}
