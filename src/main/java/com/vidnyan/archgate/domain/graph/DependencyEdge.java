package com.vidnyan.archgate.domain.graph;

import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.Role;

import java.util.List;

/**
 * Directed edge from a file to what one of its references resolved to.
 *
 * @param sourceId     id of the referencing file
 * @param reference    the raw reference
 * @param resolution   how the reference resolved
 * @param targetId     id of the target when {@code RESOLVED}, otherwise -1
 * @param candidateIds candidate ids when {@code UNRESOLVED_AMBIGUOUS}, otherwise empty
 * @param inferredRole role of the target, or the role implied by the reference's name prefix; null when unknown
 */
public record DependencyEdge(
    int sourceId,
    RawReference reference,
    Resolution resolution,
    int targetId,
    List<Integer> candidateIds,
    Role inferredRole
) {

    public static final int NO_TARGET = -1;

    public DependencyEdge {
        candidateIds = List.copyOf(candidateIds);
    }

    public static DependencyEdge resolved(int sourceId, RawReference reference, int targetId, Role role) {
        return new DependencyEdge(sourceId, reference, Resolution.RESOLVED, targetId, List.of(), role);
    }

    public static DependencyEdge external(int sourceId, RawReference reference, Role inferredRole) {
        return new DependencyEdge(sourceId, reference, Resolution.EXTERNAL, NO_TARGET, List.of(), inferredRole);
    }

    public static DependencyEdge ambiguous(int sourceId, RawReference reference, List<Integer> candidates,
                                           Role inferredRole) {
        return new DependencyEdge(sourceId, reference, Resolution.UNRESOLVED_AMBIGUOUS, NO_TARGET,
                candidates, inferredRole);
    }

    public boolean isResolved() {
        return resolution == Resolution.RESOLVED;
    }

    public boolean isAmbiguous() {
        return resolution == Resolution.UNRESOLVED_AMBIGUOUS;
    }
}
