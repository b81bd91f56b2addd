package com.vidnyan.archgate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the gate.
 * Set via application.properties or as {@code --gate.x=y} command-line arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "gate")
public class GateProperties {

    /**
     * Run the gate on startup. Disabled in tests that only need the context.
     */
    private boolean enabled = true;

    /**
     * Repository to check.
     */
    private String repoRoot = ".";

    /**
     * Code roots, relative to the repository root.
     * Default: {@link #defaultCodeRoot} when that folder exists.
     */
    private List<String> codeRoots = new ArrayList<>();

    private String defaultCodeRoot = "codes/comsect1";

    /**
     * Folder holding {@code specs/} and {@code README.md}.
     * Default: the repository root when it has a {@code specs/} folder.
     */
    private String docRoot;

    /**
     * Report file, relative to the repository root.
     */
    private String reportPath = ".archgate-report.json";

    private boolean skipDocs;

    private boolean skipCode;

    /**
     * Dialect ids whose code stages are skipped, e.g. {@code vb}.
     */
    private List<String> skipDialects = new ArrayList<>();

    /**
     * Extraction workers. 0 = available processors.
     */
    private int workerThreads = 0;

    private Duration adapterTimeout = Duration.ofSeconds(10);

    private int adapterMaxAttempts = 2;

    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }
}
