package com.vidnyan.archgate.domain.model;

/**
 * Role, feature and category of one in-scope file.
 * Computed once by {@link RoleClassifier} and cached on the {@link SourceFile}.
 *
 * @param role               inferred role, {@code UNCLASSIFIED} when naming or placement is invalid
 * @param feature            feature id, empty for files outside any feature
 * @param category           prefix token ({@code ida}, {@code hal}, ...), empty when unknown
 * @param contractVocabulary true for the shared contract file Intent may reference
 * @param projectScoped      true when the file lives under a {@code project/} folder
 * @param legacyLayout       deprecated folder shape the file lives under, or null
 * @param namingIssue        why classification failed, or null
 */
public record Classification(
    Role role,
    String feature,
    String category,
    boolean contractVocabulary,
    boolean projectScoped,
    LegacyLayout legacyLayout,
    NamingIssue namingIssue
) {

    public enum IssueKind {
        UNKNOWN_PREFIX,
        MISPLACED,
        RESERVED_PREFIX
    }

    public record NamingIssue(IssueKind kind, String message) {}

    public static Classification valid(Role role, String feature, String category,
                                       boolean contractVocabulary, boolean projectScoped,
                                       LegacyLayout legacyLayout) {
        return new Classification(role, feature, category, contractVocabulary, projectScoped,
                legacyLayout, null);
    }

    public static Classification invalid(String category, boolean projectScoped,
                                         LegacyLayout legacyLayout, IssueKind kind, String message) {
        return new Classification(Role.UNCLASSIFIED, "", category, false, projectScoped,
                legacyLayout, new NamingIssue(kind, message));
    }

    /**
     * An unprefixed file under a deprecated folder: no role, kept only so the folder is reported.
     */
    public static Classification legacyOnly(boolean projectScoped, LegacyLayout legacyLayout) {
        return new Classification(Role.UNCLASSIFIED, "", "", false, projectScoped, legacyLayout, null);
    }

    public boolean hasFeature() {
        return !feature.isEmpty();
    }

    public boolean isLegacy() {
        return legacyLayout != null;
    }
}
