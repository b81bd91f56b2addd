package com.vidnyan.archgate.domain.stage;

import com.vidnyan.archgate.domain.rule.EngineFault;
import com.vidnyan.archgate.domain.rule.Finding;

import java.util.List;

/**
 * A finished stage.
 *
 * @param name          stage name, {@code docs} or {@code code-<dialect>[:<root>]}
 * @param status        terminal status
 * @param exitCode      exit indicator of the status
 * @param note          one-line summary
 * @param outputPath    artifact file, null when none was written
 * @param root          scanned root, relative to the repository root where possible
 * @param dialect       dialect id, null for the documentation stage
 * @param filesScanned  number of files inspected
 * @param errorCount    number of ERROR findings
 * @param advisoryCount number of ADVISORY findings
 * @param findings      sorted findings
 * @param faults        internal engine faults
 */
public record Stage(
    String name,
    StageStatus status,
    int exitCode,
    String note,
    String outputPath,
    String root,
    String dialect,
    int filesScanned,
    int errorCount,
    int advisoryCount,
    List<Finding> findings,
    List<EngineFault> faults
) {

    public Stage {
        findings = List.copyOf(findings);
        faults = List.copyOf(faults);
    }

    public boolean isSkipped() {
        return status == StageStatus.SKIPPED;
    }

    public boolean passed() {
        return status == StageStatus.PASS;
    }

    public Stage withOutputPath(String path) {
        return new Stage(name, status, exitCode, note, path, root, dialect, filesScanned,
                errorCount, advisoryCount, findings, faults);
    }
}
