package com.vidnyan.archgate.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies files into role, feature and category from path and file name alone.
 * <p>
 * Pure and deterministic: the same relative path always yields the same classification,
 * regardless of scan order. Paths are relative to the code root and {@code /}-separated.
 * </p>
 * <p>
 * Placement is checked relative to the code root or to a nested architecture unit vendored
 * under {@code deps/extern/} or {@code deps/middleware/}. Files under a {@link LegacyLayout}
 * are classified by prefix only; their placement is reported by the legacy-layout rule.
 * Unprefixed files under a legacy folder stay in scope so the folder itself is reported.
 * </p>
 */
public final class RoleClassifier {

    public static final String CORE_FEATURE = "core";
    public static final String CONTRACT_VOCABULARY_STEM = "cfg_core";

    private static final Set<String> CORE_STEMS = Set.of("ida_core", "prx_core", "poi_core", CONTRACT_VOCABULARY_STEM);
    private static final Set<String> PROJECT_CONFIG_STEMS = Set.of("cfg_project", "db_project");

    // Unknown prefixes are only reported inside these folders; elsewhere the file is out of scope.
    private static final List<String> MANAGED_DIRECTORIES = List.of(
            "project/features", "project/config", "project/datastreams", "infra/bootstrap");

    // Anchored at the code root or at the root of one nested architecture unit.
    private static final Pattern FEATURE_FOLDER = Pattern.compile(
            "^(?:deps/(?:extern|middleware)/[^/]+/)?project/features/([^/]+)/");
    private static final Pattern LEGACY_FEATURE_FOLDER = Pattern.compile("^features/([^/]+)/");

    /**
     * Classify one file.
     *
     * @return empty when the file is outside the in-scope naming patterns
     */
    public Optional<Classification> classify(String relativePath) {
        String path = normalize(relativePath);
        String stem = stemOf(path).toLowerCase(Locale.ROOT);
        boolean projectScoped = path.startsWith("project/") || path.contains("/project/");
        LegacyLayout legacy = LegacyLayout.of(path).orElse(null);

        if (RolePrefix.isReserved(stem)) {
            return Optional.of(Classification.invalid(RolePrefix.RESERVED_LAYOUT_PREFIX, projectScoped, legacy,
                    Classification.IssueKind.RESERVED_PREFIX,
                    "Prefix '" + RolePrefix.RESERVED_LAYOUT_PREFIX + "_' is reserved for folder grouping and is not a role prefix"));
        }

        Optional<RolePrefix> maybePrefix = RolePrefix.ofStem(stem);
        if (maybePrefix.isEmpty() && legacy != null) {
            return Optional.of(Classification.legacyOnly(projectScoped, legacy));
        }
        if (maybePrefix.isEmpty()) {
            if (MANAGED_DIRECTORIES.stream().anyMatch(dir -> path.startsWith(dir + "/"))) {
                return Optional.of(Classification.invalid("", projectScoped, legacy,
                        Classification.IssueKind.UNKNOWN_PREFIX,
                        "Unknown architecture role prefix: " + fileNameOf(path)));
            }
            return Optional.empty();
        }

        RolePrefix prefix = maybePrefix.get();
        if (legacy == null) {
            String misplacement = placementViolation(prefix, stem, path);
            if (misplacement != null) {
                return Optional.of(Classification.invalid(prefix.token(), projectScoped, null,
                        Classification.IssueKind.MISPLACED, misplacement));
            }
        }

        return Optional.of(Classification.valid(
                prefix.role(),
                featureOf(prefix, stem, path, legacy),
                prefix.token(),
                CONTRACT_VOCABULARY_STEM.equals(stem),
                projectScoped,
                legacy));
    }

    private String featureOf(RolePrefix prefix, String stem, String path, LegacyLayout legacy) {
        if (CORE_STEMS.contains(stem)) {
            return CORE_FEATURE;
        }
        boolean featureAware = prefix.role().isFeatureScoped() || prefix == RolePrefix.CFG || prefix == RolePrefix.DB;
        if (!featureAware) {
            return "";
        }
        Matcher matcher = FEATURE_FOLDER.matcher(path);
        if (matcher.find()) {
            return matcher.group(1);
        }
        if (legacy == LegacyLayout.FEATURES) {
            Matcher legacyMatcher = LEGACY_FEATURE_FOLDER.matcher(path);
            if (legacyMatcher.find()) {
                return legacyMatcher.group(1);
            }
        }
        if (legacy != null && prefix.role().isFeatureScoped()) {
            // Legacy flat layouts carry the feature in the name only.
            return stem.substring(prefix.token().length() + 1);
        }
        return "";
    }

    private String placementViolation(RolePrefix prefix, String stem, String path) {
        if (CORE_STEMS.contains(stem)) {
            return underAny(path, "infra/bootstrap") ? null
                    : stem + " must be located under infra/bootstrap/ (root or nested architecture unit)";
        }
        return switch (prefix) {
            case IDA, PRX, POI -> FEATURE_FOLDER.matcher(path).find() ? null
                    : prefix.token() + "_* feature files must be located in a folder under project/features/";
            case SVC -> underAny(path, "infra/service") ? null
                    : "svc_* files must be located under infra/service/";
            case HAL -> underAny(path, "infra/platform/hal") ? null
                    : "hal_* files must be located under infra/platform/hal/";
            case BSP -> underAny(path, "infra/platform/bsp") ? null
                    : "bsp_* files must be located under infra/platform/bsp/";
            case MDW -> isNestedUnit(path) ? null
                    : "mdw_* files must be located under deps/middleware/ or deps/extern/";
            case STM -> underAny(path, "project/datastreams") || isNestedUnit(path) ? null
                    : "stm_* files must be located under project/datastreams/, deps/middleware/ or deps/extern/";
            case CFG, DB -> resourcePlacementViolation(prefix, stem, path);
        };
    }

    private String resourcePlacementViolation(RolePrefix prefix, String stem, String path) {
        boolean externalNonFractal = isNestedUnit(path)
                && !path.contains("/project/features/") && !path.contains("/project/config/");
        if (externalNonFractal) {
            return null;
        }
        if (PROJECT_CONFIG_STEMS.contains(stem)) {
            return underAny(path, "project/config") ? null
                    : stem + " must be located under project/config/";
        }
        return underAny(path, "project/features") || underAny(path, "project/config") ? null
                : prefix.token() + "_* resource files must be located under project/features/ or project/config/";
    }

    private static boolean underAny(String path, String directory) {
        return path.startsWith(directory + "/") || (isNestedUnit(path) && path.contains("/" + directory + "/"));
    }

    private static boolean isNestedUnit(String path) {
        return path.startsWith("deps/extern/") || path.startsWith("deps/middleware/");
    }

    static String normalize(String relativePath) {
        String path = relativePath.replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return path;
    }

    public static String fileNameOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    public static String stemOf(String path) {
        String fileName = fileNameOf(path);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
