package com.vidnyan.archgate.domain.stage;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated result of one gate run.
 */
public record GateReport(
    Instant generatedAtUtc,
    String repoRoot,
    List<Stage> stages,
    boolean gatePassed
) {

    public static final int EXIT_PASS = 0;
    public static final int EXIT_CONFIGURATION_ERROR = 1;
    public static final int EXIT_VIOLATIONS = 2;
    public static final int EXIT_INTERNAL_FAULT = 3;

    public GateReport {
        stages = List.copyOf(stages);
    }

    /**
     * Aggregate pass is the AND over all stages that were not skipped.
     */
    public static GateReport aggregate(Instant generatedAt, String repoRoot, List<Stage> stages) {
        boolean passed = stages.stream()
                .filter(stage -> !stage.isSkipped())
                .allMatch(Stage::passed);
        return new GateReport(generatedAt, repoRoot, stages, passed);
    }

    public int exitCode() {
        if (stages.stream().anyMatch(stage -> stage.status() == StageStatus.ERRORED)) {
            return EXIT_INTERNAL_FAULT;
        }
        return gatePassed ? EXIT_PASS : EXIT_VIOLATIONS;
    }
}
