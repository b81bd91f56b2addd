package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.graph.DependencyEdge;
import com.vidnyan.archgate.domain.graph.DependencyGraph;
import com.vidnyan.archgate.domain.model.Classification;
import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.RoleClassifier;
import com.vidnyan.archgate.domain.model.RolePrefix;
import com.vidnyan.archgate.domain.model.SourceFile;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * What an edge points at, as far as rules are concerned.
 * <p>
 * For in-project files this is the target's classification. For references that did not
 * resolve in-project it is inferred from the reference's name prefix, with the feature
 * unknown and ownership judged by name.
 * </p>
 *
 * @param role               target role
 * @param feature            target feature, null when only the name is known
 * @param category           prefix token
 * @param stem               lower-case file stem or reference leaf without extension
 * @param contractVocabulary true for the contract vocabulary file
 * @param projectScoped      true for in-project files under a {@code project/} folder
 */
record EdgeTarget(
    Role role,
    String feature,
    String category,
    String stem,
    boolean contractVocabulary,
    boolean projectScoped
) {

    static EdgeTarget of(SourceFile file) {
        Classification c = file.classification();
        return new EdgeTarget(c.role(), c.feature(), c.category(), file.stem().toLowerCase(Locale.ROOT),
                c.contractVocabulary(), c.projectScoped());
    }

    static Optional<EdgeTarget> byName(String referenceName) {
        String leaf = RoleClassifier.fileNameOf(referenceName.replace('\\', '/'));
        String stem = RoleClassifier.stemOf(leaf).toLowerCase(Locale.ROOT);
        return RolePrefix.ofStem(stem).map(prefix -> new EdgeTarget(prefix.role(), null, prefix.token(), stem,
                RoleClassifier.CONTRACT_VOCABULARY_STEM.equals(stem), false));
    }

    /**
     * Targets of an edge: the resolved file, every ambiguous candidate, or the name-inferred target.
     * Empty when nothing is known about the target.
     */
    static List<EdgeTarget> of(DependencyGraph graph, DependencyEdge edge) {
        return switch (edge.resolution()) {
            case RESOLVED -> List.of(of(graph.file(edge.targetId())));
            case UNRESOLVED_AMBIGUOUS -> edge.candidateIds().stream().map(graph::file).map(EdgeTarget::of).toList();
            case EXTERNAL -> edge.reference().system() ? List.of()
                    : byName(edge.reference().name()).map(List::of).orElse(List.of());
        };
    }

    boolean isFile() {
        return feature != null;
    }

    /**
     * True when the target belongs to the given feature.
     */
    boolean ownedBy(String owner) {
        if (owner == null || owner.isEmpty()) {
            return false;
        }
        if (feature != null) {
            return feature.equalsIgnoreCase(owner);
        }
        String owned = category + "_" + owner.toLowerCase(Locale.ROOT);
        return stem.equals(owned) || stem.startsWith(owned + "_");
    }

    String describe() {
        return isFile() && !feature.isEmpty()
                ? role.displayName() + " of feature '" + feature + "'"
                : role.displayName();
    }
}
