package com.vidnyan.archgate.domain.stage;

/**
 * Lifecycle of a gate stage.
 */
public enum StageStatus {
    PENDING(-1),
    RUNNING(-1),
    PASS(0),
    FAIL(2),
    ERRORED(3),
    SKIPPED(0);

    private final int exitCode;

    StageStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * Exit indicator of a finished stage.
     *
     * @throws IllegalStateException for a stage that has not finished
     */
    public int exitCode() {
        if (!isTerminal()) {
            throw new IllegalStateException("Stage has not finished: " + this);
        }
        return exitCode;
    }

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
