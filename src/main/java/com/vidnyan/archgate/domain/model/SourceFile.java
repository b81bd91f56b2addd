package com.vidnyan.archgate.domain.model;

import java.util.List;

/**
 * A classified, extracted source file. Node of the dependency graph.
 *
 * @param id             index in the graph arena
 * @param path           path relative to the scanned code root, {@code /}-separated
 * @param dialect        dialect id of the adapter that extracted it
 * @param classification role, feature and category, computed once
 * @param references     raw outbound references in declaration order
 * @param signals        structural signals
 * @param restrictedCalls calls to APIs reserved for lower roles
 */
public record SourceFile(
    int id,
    String path,
    String dialect,
    Classification classification,
    List<RawReference> references,
    StructuralSignals signals,
    List<RestrictedCall> restrictedCalls
) {

    public SourceFile {
        references = List.copyOf(references);
        restrictedCalls = List.copyOf(restrictedCalls);
    }

    public SourceFile(int id, String path, String dialect, Classification classification,
                      List<RawReference> references, StructuralSignals signals) {
        this(id, path, dialect, classification, references, signals, List.of());
    }

    public Role role() {
        return classification.role();
    }

    public String feature() {
        return classification.feature();
    }

    public String fileName() {
        return RoleClassifier.fileNameOf(path);
    }

    public String stem() {
        return RoleClassifier.stemOf(path);
    }

    /**
     * Folder part of the path, empty for files at the root.
     */
    public String folder() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(0, slash) : "";
    }
}
