package com.vidnyan.archgate.domain.graph;

import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.RolePrefix;
import com.vidnyan.archgate.domain.model.RoleClassifier;
import com.vidnyan.archgate.domain.model.SourceFile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves raw references to files of the same graph by logical name.
 * <p>
 * Candidates are files whose name equals the reference leaf, or whose stem equals it when the
 * leaf has no extension. Candidates in one folder resolve to the first path; candidates spread
 * over several folders are narrowed by the reference's path hint, and stay ambiguous otherwise.
 * A reference is never guessed.
 * </p>
 */
public class ReferenceResolver {

    private final List<SourceFile> files;
    private final Map<String, List<SourceFile>> byFileName = new HashMap<>();
    private final Map<String, List<SourceFile>> byStem = new HashMap<>();

    public ReferenceResolver(List<SourceFile> files) {
        this.files = files;
        for (SourceFile file : files) {
            byFileName.computeIfAbsent(file.fileName().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(file);
            byStem.computeIfAbsent(file.stem().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(file);
        }
    }

    /**
     * Resolve every reference of every file, in file then declaration order.
     */
    public List<DependencyEdge> resolveAll() {
        List<DependencyEdge> edges = new ArrayList<>();
        for (SourceFile file : files) {
            for (RawReference reference : file.references()) {
                edges.add(resolve(file.id(), reference));
            }
        }
        return edges;
    }

    public DependencyEdge resolve(int sourceId, RawReference reference) {
        if (reference.system()) {
            return DependencyEdge.external(sourceId, reference, null);
        }

        String leaf = leafOf(reference.name()).toLowerCase(Locale.ROOT);
        boolean hasExtension = leaf.lastIndexOf('.') > 0;
        List<SourceFile> candidates = (hasExtension ? byFileName : byStem).getOrDefault(leaf, List.of()).stream()
                .filter(candidate -> candidate.id() != sourceId)
                .sorted(Comparator.comparing(SourceFile::path))
                .toList();

        if (candidates.isEmpty()) {
            return DependencyEdge.external(sourceId, reference, roleByName(leaf));
        }

        Map<String, List<SourceFile>> byFolder = groupByFolder(candidates);
        if (byFolder.size() > 1) {
            List<SourceFile> narrowed = candidates.stream()
                    .filter(candidate -> matchesPathHint(candidate.path(), reference.pathHint()))
                    .toList();
            if (!narrowed.isEmpty()) {
                byFolder = groupByFolder(narrowed);
                candidates = narrowed;
            }
        }

        if (byFolder.size() == 1) {
            SourceFile target = candidates.get(0);
            return DependencyEdge.resolved(sourceId, reference, target.id(), target.role());
        }
        return DependencyEdge.ambiguous(sourceId, reference,
                candidates.stream().map(SourceFile::id).toList(), roleByName(leaf));
    }

    private static Map<String, List<SourceFile>> groupByFolder(List<SourceFile> candidates) {
        Map<String, List<SourceFile>> byFolder = new LinkedHashMap<>();
        for (SourceFile candidate : candidates) {
            byFolder.computeIfAbsent(candidate.folder(), k -> new ArrayList<>()).add(candidate);
        }
        return byFolder;
    }

    /**
     * True when the candidate path, without extension, ends with the hint on a folder boundary.
     */
    static boolean matchesPathHint(String candidatePath, String pathHint) {
        String hint = stripExtension(normalizeHint(pathHint)).toLowerCase(Locale.ROOT);
        if (hint.isEmpty()) {
            return false;
        }
        String path = stripExtension(candidatePath).toLowerCase(Locale.ROOT);
        if (path.equals(hint)) {
            return true;
        }
        return path.endsWith(hint) && path.charAt(path.length() - hint.length() - 1) == '/';
    }

    private static String normalizeHint(String pathHint) {
        String hint = pathHint.replace('\\', '/');
        while (hint.startsWith("../") || hint.startsWith("./")) {
            hint = hint.substring(hint.indexOf('/') + 1);
        }
        return hint;
    }

    private static String stripExtension(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash + 1 ? path.substring(0, dot) : path;
    }

    private static String leafOf(String name) {
        String normalized = name.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    /**
     * Role implied by a name's prefix, null when the name carries no known prefix.
     */
    public static Role roleByName(String leaf) {
        return RolePrefix.ofStem(RoleClassifier.stemOf(leaf)).map(RolePrefix::role).orElse(null);
    }
}
