package com.vidnyan.archgate.domain.model;

import java.util.Optional;

/**
 * Deprecated folder shapes, relative to the code root.
 */
public enum LegacyLayout {
    CORE_CONFIG("core/config", "infra/bootstrap/cfg_core"),
    FEATURES("features", "project/features/"),
    MODULES("modules", "infra/ and deps/"),
    PLATFORM("platform", "infra/platform/");

    private final String directory;
    private final String migrationTarget;

    LegacyLayout(String directory, String migrationTarget) {
        this.directory = directory;
        this.migrationTarget = migrationTarget;
    }

    public String directory() {
        return directory;
    }

    public String migrationTarget() {
        return migrationTarget;
    }

    public static Optional<LegacyLayout> of(String relativePath) {
        for (LegacyLayout layout : values()) {
            if (relativePath.startsWith(layout.directory + "/")) {
                return Optional.of(layout);
            }
        }
        return Optional.empty();
    }
}
