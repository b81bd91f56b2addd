package com.vidnyan.archgate.adapter.in.cli;

import com.vidnyan.archgate.application.port.in.GateConfigurationException;
import com.vidnyan.archgate.application.port.in.RunGateUseCase;
import com.vidnyan.archgate.application.port.in.RunGateUseCase.GateRequest;
import com.vidnyan.archgate.config.GateProperties;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.stage.GateReport;
import com.vidnyan.archgate.domain.stage.Stage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * CLI runner for the gate.
 * Runs on startup unless {@code gate.enabled=false}; the process exit code is the gate's.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GateCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final int MAX_LISTED_FINDINGS = 100;

    private final RunGateUseCase runGateUseCase;
    private final GateProperties properties;

    private int exitCode = GateReport.EXIT_PASS;

    @Override
    public void run(String... args) {
        if (!properties.isEnabled()) {
            log.info("Gate disabled. Set gate.enabled=true to run it.");
            return;
        }

        GateRequest request = toRequest(properties);
        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║              ARCHGATE - Architecture Conformance Gate          ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Repository: {}", truncatePath(request.repoRoot().toString(), 50));
        log.info("╚══════════════════════════════════════════════════════════════╝");

        try {
            GateReport report = runGateUseCase.run(request);
            printResults(report);
            exitCode = report.exitCode();
        } catch (GateConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            exitCode = GateReport.EXIT_CONFIGURATION_ERROR;
        } catch (UncheckedIOException e) {
            log.error("Cannot write report: {}", e.getMessage());
            exitCode = GateReport.EXIT_INTERNAL_FAULT;
        } catch (RuntimeException e) {
            log.error("Gate run failed unexpectedly", e);
            exitCode = GateReport.EXIT_INTERNAL_FAULT;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static GateRequest toRequest(GateProperties properties) {
        Path repoRoot = Path.of(properties.getRepoRoot());

        List<Path> codeRoots;
        if (!properties.getCodeRoots().isEmpty()) {
            codeRoots = properties.getCodeRoots().stream().map(Path::of).toList();
        } else if (Files.isDirectory(repoRoot.resolve(properties.getDefaultCodeRoot()))) {
            codeRoots = List.of(Path.of(properties.getDefaultCodeRoot()));
        } else {
            codeRoots = List.of();
        }

        Path docRoot = null;
        if (properties.getDocRoot() != null && !properties.getDocRoot().isBlank()) {
            docRoot = Path.of(properties.getDocRoot());
        } else if (Files.isDirectory(repoRoot.resolve("specs"))) {
            docRoot = repoRoot;
        }

        return new GateRequest(repoRoot, codeRoots, docRoot, Path.of(properties.getReportPath()),
                properties.isSkipDocs(), properties.isSkipCode(), Set.copyOf(properties.getSkipDialects()));
    }

    private void printResults(GateReport report) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" GATE RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        for (Stage stage : report.stages()) {
            log.info(" {} {} - {}", String.format("%-8s", stage.status()), stage.name(), stage.note());
        }
        log.info("───────────────────────────────────────────────────────────────");

        int count = 0;
        for (Stage stage : report.stages()) {
            for (Finding finding : stage.findings()) {
                count++;
                if (count > MAX_LISTED_FINDINGS) {
                    continue;
                }
                String location = finding.line() > 0 ? finding.path() + ":" + finding.line() : finding.path();
                log.info(" {} [{}] {} {}", finding.isError() ? "ERROR   " : "ADVISORY", finding.ruleId(),
                        location, finding.message());
            }
        }
        if (count > MAX_LISTED_FINDINGS) {
            log.info(" ... and {} more findings", count - MAX_LISTED_FINDINGS);
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info(report.gatePassed() ? " ✅ Gate passed." : " ❌ Gate failed (exit {}).", report.exitCode());
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
