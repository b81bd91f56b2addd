package com.vidnyan.archgate.application.port.out;

import com.vidnyan.archgate.domain.stage.GateReport;
import com.vidnyan.archgate.domain.stage.Stage;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Port for persisting the gate report and per-stage artifacts.
 * I/O failures surface as {@link java.io.UncheckedIOException}.
 */
public interface ReportWriter {

    void writeStageArtifact(Path target, Stage stage, Instant generatedAt);

    void writeReport(Path target, GateReport report);
}
