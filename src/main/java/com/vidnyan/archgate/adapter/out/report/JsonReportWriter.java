package com.vidnyan.archgate.adapter.out.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.archgate.application.port.out.ReportWriter;
import com.vidnyan.archgate.domain.rule.EngineFault;
import com.vidnyan.archgate.domain.rule.Finding;
import com.vidnyan.archgate.domain.stage.GateReport;
import com.vidnyan.archgate.domain.stage.Stage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes the gate report and stage artifacts as stable JSON.
 * Fixed property order, two-space indentation, {@code \n} line breaks and a trailing newline,
 * so an unchanged tree produces byte-identical output for the same timestamp.
 */
@Slf4j
@Component
public class JsonReportWriter implements ReportWriter {

    private final ObjectWriter writer;

    public JsonReportWriter(ObjectMapper objectMapper) {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        this.writer = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .writer(printer);
    }

    @Override
    public void writeStageArtifact(Path target, Stage stage, Instant generatedAt) {
        write(target, StageArtifactDto.from(stage, generatedAt));
        log.debug("  Wrote artifact {}", target);
    }

    @Override
    public void writeReport(Path target, GateReport report) {
        write(target, GateReportDto.from(report));
        log.info("Report: {}", target);
    }

    public String renderReport(GateReport report) {
        return render(GateReportDto.from(report));
    }

    public String renderStageArtifact(Stage stage, Instant generatedAt) {
        return render(StageArtifactDto.from(stage, generatedAt));
    }

    private void write(Path target, Object dto) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, render(dto), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    private String render(Object dto) {
        try {
            return writer.writeValueAsString(dto) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + dto.getClass().getSimpleName(), e);
        }
    }

    @JsonPropertyOrder({"generatedAtUtc", "repoRoot", "stages", "gatePassed"})
    record GateReportDto(String generatedAtUtc, String repoRoot, List<StageDto> stages, boolean gatePassed) {
        static GateReportDto from(GateReport report) {
            return new GateReportDto(report.generatedAtUtc().toString(), report.repoRoot(),
                    report.stages().stream().map(StageDto::from).toList(), report.gatePassed());
        }
    }

    @JsonPropertyOrder({"name", "status", "exitCode", "note", "outputPath", "filesScanned", "errorCount", "advisoryCount"})
    record StageDto(String name, String status, int exitCode, String note, String outputPath,
                    int filesScanned, int errorCount, int advisoryCount) {
        static StageDto from(Stage stage) {
            return new StageDto(stage.name(), stage.status().name(), stage.exitCode(), stage.note(),
                    stage.outputPath(), stage.filesScanned(), stage.errorCount(), stage.advisoryCount());
        }
    }

    @JsonPropertyOrder({"stage", "status", "generatedAtUtc", "root", "dialect", "filesScanned", "errorCount",
            "advisoryCount", "findings", "faults"})
    record StageArtifactDto(String stage, String status, String generatedAtUtc, String root, String dialect,
                            int filesScanned, int errorCount, int advisoryCount,
                            List<FindingDto> findings, List<FaultDto> faults) {
        static StageArtifactDto from(Stage stage, Instant generatedAt) {
            return new StageArtifactDto(stage.name(), stage.status().name(), generatedAt.toString(), stage.root(),
                    stage.dialect(), stage.filesScanned(), stage.errorCount(), stage.advisoryCount(),
                    stage.findings().stream().map(FindingDto::from).toList(),
                    stage.faults().stream().map(FaultDto::from).toList());
        }
    }

    @JsonPropertyOrder({"severity", "file", "line", "rule", "message"})
    record FindingDto(String severity, String file, int line, String rule, String message) {
        static FindingDto from(Finding finding) {
            return new FindingDto(finding.severity().name(), finding.path(), finding.line(),
                    finding.ruleId(), finding.message());
        }
    }

    @JsonPropertyOrder({"rule", "file", "message"})
    record FaultDto(String rule, String file, String message) {
        static FaultDto from(EngineFault fault) {
            return new FaultDto(fault.ruleId(), fault.path(), fault.message());
        }
    }
}
