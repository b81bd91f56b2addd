package com.vidnyan.archgate.application.port.in;

import com.vidnyan.archgate.domain.stage.GateReport;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Primary use case: run every gate stage over a repository and aggregate the outcome.
 */
public interface RunGateUseCase {

    /**
     * Run the gate.
     * @param request what to scan and what to skip
     * @return the aggregated report, already written to {@link GateRequest#reportPath()}
     * @throws GateConfigurationException when the request is invalid;
     *         thrown before any file is scanned
     */
    GateReport run(GateRequest request);

    /**
     * Gate request parameters.
     */
    record GateRequest(
        Path repoRoot,
        List<Path> codeRoots,   // empty = nothing to scan
        Path docRoot,           // null = no documentation stage
        Path reportPath,
        boolean skipDocs,
        boolean skipCode,
        Set<String> skipDialects
    ) {
        public GateRequest {
            codeRoots = List.copyOf(codeRoots);
            skipDialects = Set.copyOf(skipDialects);
        }

        public static GateRequest forCodeRoot(Path repoRoot, Path codeRoot, Path reportPath) {
            return new GateRequest(repoRoot, List.of(codeRoot), null, reportPath, false, false, Set.of());
        }
    }
}
