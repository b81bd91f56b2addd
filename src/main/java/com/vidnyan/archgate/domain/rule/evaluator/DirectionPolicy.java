package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.RolePrefix;
import com.vidnyan.archgate.domain.model.SourceFile;

import java.util.Optional;

/**
 * Allowed reference directions between roles.
 * <p>
 * Intent references to Capability, Platform and Resource are left to
 * {@link IntentCapabilityRule} so each such edge is reported once.
 * </p>
 */
final class DirectionPolicy {

    private DirectionPolicy() {
    }

    /**
     * @return why the reference is not allowed, empty when it is
     */
    static Optional<String> check(SourceFile source, EdgeTarget target) {
        Role from = source.role();
        Role to = target.role();
        if (from == Role.UNCLASSIFIED || to == null || to == Role.UNCLASSIFIED) {
            return Optional.empty();
        }
        boolean ownFeature = target.ownedBy(source.feature());

        return switch (from) {
            case INTENT -> {
                if (target.contractVocabulary()
                        || to == Role.CAPABILITY || to == Role.PLATFORM || to == Role.RESOURCE) {
                    yield Optional.empty();
                }
                if (to == Role.DATA_PLANE) {
                    yield Optional.of("Intent must not reference DataPlane directly");
                }
                yield ownFeature ? Optional.empty()
                        : Optional.of("Intent may reference only its own feature's roles, not " + target.describe());
            }
            case INTERPRETATION -> {
                if (to == Role.INTENT) {
                    yield Optional.of("Interpretation must not reference Intent");
                }
                if ((to == Role.INTERPRETATION || to == Role.PRODUCTION) && !ownFeature) {
                    yield Optional.of("Interpretation may reference only its own feature's "
                            + "Interpretation and Production, not " + target.describe());
                }
                yield Optional.empty();
            }
            case PRODUCTION -> {
                if (to == Role.INTENT || to == Role.INTERPRETATION) {
                    yield Optional.of("Production must not reference " + to.displayName() + " (no reverse dependency)");
                }
                if (to == Role.PRODUCTION && !ownFeature) {
                    yield Optional.of("Production may reference only its own feature's Production, not "
                            + target.describe());
                }
                yield Optional.empty();
            }
            case CAPABILITY -> {
                if (to.isFeatureScoped()) {
                    yield Optional.of("Capability must not reference upper-layer " + to.displayName());
                }
                yield projectResource(target)
                        ? Optional.of("Capability must not reference project resources directly")
                        : Optional.empty();
            }
            case PLATFORM -> {
                if (to.isFeatureScoped() || to == Role.CAPABILITY) {
                    yield Optional.of("Platform must not reference " + to.displayName());
                }
                if (RolePrefix.BSP.token().equals(source.classification().category())
                        && RolePrefix.HAL.token().equals(target.category())) {
                    yield Optional.of("bsp_ must not reference hal_ (direction is hal_ to bsp_)");
                }
                yield projectResource(target)
                        ? Optional.of("Platform must not reference project resources directly")
                        : Optional.empty();
            }
            case RESOURCE, DATA_PLANE -> to.isFeatureScoped()
                    ? Optional.of(from.displayName() + " must not reference upper-layer " + to.displayName())
                    : Optional.empty();
            case UNCLASSIFIED -> Optional.empty();
        };
    }

    private static boolean projectResource(EdgeTarget target) {
        return !target.contractVocabulary()
                && (target.role() == Role.RESOURCE || target.role() == Role.DATA_PLANE)
                && target.projectScoped();
    }
}
