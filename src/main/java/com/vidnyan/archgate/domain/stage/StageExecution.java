package com.vidnyan.archgate.domain.stage;

import com.vidnyan.archgate.domain.rule.EngineFault;
import com.vidnyan.archgate.domain.rule.Finding;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state machine of one stage while it runs.
 * <p>
 * {@code PENDING -> RUNNING -> PASS | FAIL | ERRORED}, or {@code PENDING -> SKIPPED}.
 * Any other transition throws {@link IllegalStateException}. Not thread-safe; a stage is
 * driven by a single thread.
 * </p>
 */
public class StageExecution {

    private final String name;
    private final String root;
    private final String dialect;

    private StageStatus status = StageStatus.PENDING;
    private String note = "";
    private int filesScanned;
    private final List<Finding> findings = new ArrayList<>();
    private final List<EngineFault> faults = new ArrayList<>();

    public StageExecution(String name, String root, String dialect) {
        this.name = name;
        this.root = root;
        this.dialect = dialect;
    }

    public String name() {
        return name;
    }

    public StageStatus status() {
        return status;
    }

    public void start() {
        transition(StageStatus.PENDING, StageStatus.RUNNING);
    }

    public void skip(String reason) {
        transition(StageStatus.PENDING, StageStatus.SKIPPED);
        this.note = reason;
    }

    /**
     * Finish a running stage. Status follows from what was recorded: any fault makes it
     * {@code ERRORED}, otherwise any ERROR finding makes it {@code FAIL}.
     */
    public void complete(int files, List<Finding> stageFindings, List<EngineFault> stageFaults, String summary) {
        requireStatus(StageStatus.RUNNING);
        this.filesScanned = files;
        this.findings.addAll(stageFindings);
        this.findings.sort(Finding.ORDER);
        this.faults.addAll(stageFaults);
        this.note = summary;
        if (!faults.isEmpty()) {
            status = StageStatus.ERRORED;
        } else if (findings.stream().anyMatch(Finding::isError)) {
            status = StageStatus.FAIL;
        } else {
            status = StageStatus.PASS;
        }
    }

    /**
     * Finish a running stage that crashed outside rule evaluation.
     */
    public void abort(EngineFault fault) {
        requireStatus(StageStatus.RUNNING);
        this.faults.add(fault);
        this.note = "Internal fault: " + fault.message();
        status = StageStatus.ERRORED;
    }

    public Stage toStage() {
        if (!status.isTerminal()) {
            throw new IllegalStateException("Stage " + name + " has not finished: " + status);
        }
        int errors = (int) findings.stream().filter(Finding::isError).count();
        return new Stage(name, status, status.exitCode(), note, null, root, dialect, filesScanned,
                errors, findings.size() - errors, findings, faults);
    }

    private void transition(StageStatus from, StageStatus to) {
        requireStatus(from);
        status = to;
    }

    private void requireStatus(StageStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Stage " + name + " is " + status + ", expected " + expected);
        }
    }
}
