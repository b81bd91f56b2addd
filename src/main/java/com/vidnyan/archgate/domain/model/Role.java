package com.vidnyan.archgate.domain.model;

/**
 * Architectural role of a source file.
 * Inferred once from file name and placement, never from content.
 */
public enum Role {
    INTENT,          // decides
    INTERPRETATION,  // adapts externally-shaped data
    PRODUCTION,      // executes against capability/platform code
    RESOURCE,
    CAPABILITY,
    PLATFORM,
    DATA_PLANE,
    UNCLASSIFIED;

    /**
     * Intent, Interpretation and Production belong to exactly one feature.
     */
    public boolean isFeatureScoped() {
        return this == INTENT || this == INTERPRETATION || this == PRODUCTION;
    }

    public String displayName() {
        return switch (this) {
            case INTENT -> "Intent";
            case INTERPRETATION -> "Interpretation";
            case PRODUCTION -> "Production";
            case RESOURCE -> "Resource";
            case CAPABILITY -> "Capability";
            case PLATFORM -> "Platform";
            case DATA_PLANE -> "DataPlane";
            case UNCLASSIFIED -> "Unclassified";
        };
    }
}
