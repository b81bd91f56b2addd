package com.vidnyan.archgate.domain.graph;

import com.vidnyan.archgate.domain.model.SourceFile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * File-level dependency graph of one code root and dialect.
 * <p>
 * Files live in an arena indexed by {@link SourceFile#id()}; edges reference files by index.
 * The graph is read-only once {@link #freeze} returns, so rules may share it across threads.
 * </p>
 */
public final class DependencyGraph {

    private final String codeRoot;
    private final String dialect;
    private final List<SourceFile> files;
    private final List<DependencyEdge> edges;
    private final List<List<DependencyEdge>> outgoing;

    private DependencyGraph(String codeRoot, String dialect, List<SourceFile> files,
                            List<DependencyEdge> edges, List<List<DependencyEdge>> outgoing) {
        this.codeRoot = codeRoot;
        this.dialect = dialect;
        this.files = files;
        this.edges = edges;
        this.outgoing = outgoing;
    }

    /**
     * Freeze files and edges into an immutable graph.
     *
     * @throws IllegalArgumentException when a file id does not match its position or an edge points outside the arena
     */
    public static DependencyGraph freeze(String codeRoot, String dialect,
                                         List<SourceFile> files, List<DependencyEdge> edges) {
        for (int i = 0; i < files.size(); i++) {
            if (files.get(i).id() != i) {
                throw new IllegalArgumentException("File id " + files.get(i).id() + " at position " + i);
            }
        }

        List<List<DependencyEdge>> bySource = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            bySource.add(new ArrayList<>());
        }
        for (DependencyEdge edge : edges) {
            checkIndex(edge.sourceId(), files.size());
            if (edge.isResolved()) {
                checkIndex(edge.targetId(), files.size());
            }
            edge.candidateIds().forEach(id -> checkIndex(id, files.size()));
            bySource.get(edge.sourceId()).add(edge);
        }

        List<List<DependencyEdge>> frozen = new ArrayList<>(bySource.size());
        for (List<DependencyEdge> list : bySource) {
            frozen.add(List.copyOf(list));
        }
        return new DependencyGraph(codeRoot, dialect, List.copyOf(files), List.copyOf(edges),
                Collections.unmodifiableList(frozen));
    }

    private static void checkIndex(int id, int size) {
        if (id < 0 || id >= size) {
            throw new IllegalArgumentException("Edge references unknown file id " + id);
        }
    }

    public String codeRoot() {
        return codeRoot;
    }

    public String dialect() {
        return dialect;
    }

    public List<SourceFile> files() {
        return files;
    }

    public SourceFile file(int id) {
        return files.get(id);
    }

    public List<DependencyEdge> edges() {
        return edges;
    }

    /**
     * Edges leaving a file, in reference declaration order.
     */
    public List<DependencyEdge> outgoing(int fileId) {
        return outgoing.get(fileId);
    }

    public GraphStats stats() {
        int resolved = 0;
        int external = 0;
        int ambiguous = 0;
        for (DependencyEdge edge : edges) {
            switch (edge.resolution()) {
                case RESOLVED -> resolved++;
                case EXTERNAL -> external++;
                case UNRESOLVED_AMBIGUOUS -> ambiguous++;
            }
        }
        return new GraphStats(files.size(), edges.size(), resolved, external, ambiguous);
    }

    public record GraphStats(int fileCount, int edgeCount, int resolved, int external, int ambiguous) {}
}
