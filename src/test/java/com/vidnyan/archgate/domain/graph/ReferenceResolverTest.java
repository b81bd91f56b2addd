package com.vidnyan.archgate.domain.graph;

import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.Role;
import com.vidnyan.archgate.domain.model.RoleClassifier;
import com.vidnyan.archgate.domain.model.SourceFile;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    private final RoleClassifier classifier = new RoleClassifier();

    @Test
    void resolve_UniqueFileNameResolves() {
        List<SourceFile> files = files(
                "project/features/alpha/ida_alpha.c",
                "infra/service/svc_uart.h");
        ReferenceResolver resolver = new ReferenceResolver(files);

        DependencyEdge edge = resolver.resolve(0, RawReference.of("../../../infra/service/svc_uart.h", "svc_uart.h", 3, false));

        assertEquals(Resolution.RESOLVED, edge.resolution());
        assertEquals(1, edge.targetId());
        assertEquals(Role.CAPABILITY, edge.inferredRole());
    }

    @Test
    void resolve_SystemReferenceIsExternal() {
        ReferenceResolver resolver = new ReferenceResolver(files("project/features/alpha/ida_alpha.c"));

        DependencyEdge edge = resolver.resolve(0, RawReference.of("stdint.h", "stdint.h", 1, true));

        assertEquals(Resolution.EXTERNAL, edge.resolution());
        assertEquals(DependencyEdge.NO_TARGET, edge.targetId());
        assertNull(edge.inferredRole());
    }

    @Test
    void resolve_UnknownNameIsExternalWithRoleFromPrefix() {
        ReferenceResolver resolver = new ReferenceResolver(files("project/features/alpha/ida_alpha.c"));

        DependencyEdge edge = resolver.resolve(0, RawReference.of("hal_adc.h", "hal_adc.h", 2, false));

        assertEquals(Resolution.EXTERNAL, edge.resolution());
        assertEquals(Role.PLATFORM, edge.inferredRole());
    }

    @Test
    void resolve_SameNameInSeveralFoldersIsAmbiguous() {
        List<SourceFile> files = files(
                "project/features/alpha/ida_alpha.c",
                "infra/service/svc_log.h",
                "deps/extern/motor/infra/service/svc_log.h");
        ReferenceResolver resolver = new ReferenceResolver(files);

        DependencyEdge edge = resolver.resolve(0, RawReference.of("svc_log.h", "svc_log.h", 1, false));

        assertEquals(Resolution.UNRESOLVED_AMBIGUOUS, edge.resolution());
        assertEquals(List.of(2, 1), edge.candidateIds());
    }

    @Test
    void resolve_PathHintNarrowsAmbiguousCandidates() {
        List<SourceFile> files = files(
                "project/features/alpha/ida_alpha.c",
                "infra/service/svc_log.h",
                "deps/extern/motor/infra/service/svc_log.h");
        ReferenceResolver resolver = new ReferenceResolver(files);

        DependencyEdge edge = resolver.resolve(0,
                RawReference.of("motor/infra/service/svc_log.h", "svc_log.h", 1, false));

        assertEquals(Resolution.RESOLVED, edge.resolution());
        assertEquals(2, edge.targetId());
    }

    @Test
    void resolve_NameWithoutExtensionMatchesStem() {
        List<SourceFile> files = files(
                "project/features/alpha/ida_alpha.cs",
                "infra/service/svc_uart.cs");
        ReferenceResolver resolver = new ReferenceResolver(files);

        DependencyEdge edge = resolver.resolve(0, new RawReference("Company.Infra.svc_uart", "svc_uart",
                "Company/Infra/svc_uart", 1, false));

        assertEquals(Resolution.RESOLVED, edge.resolution());
        assertEquals(1, edge.targetId());
    }

    @Test
    void resolveAll_KeepsDeclarationOrder() {
        List<SourceFile> files = new ArrayList<>(files("infra/service/svc_uart.h"));
        files.add(new SourceFile(1, "project/features/alpha/poi_alpha.c", "c",
                classifier.classify("project/features/alpha/poi_alpha.c").orElseThrow(),
                List.of(RawReference.of("svc_uart.h", "svc_uart.h", 1, false),
                        RawReference.of("stdio.h", "stdio.h", 2, true)),
                StructuralSignals.empty()));

        List<DependencyEdge> edges = new ReferenceResolver(files).resolveAll();

        assertEquals(2, edges.size());
        assertEquals(Resolution.RESOLVED, edges.get(0).resolution());
        assertEquals(Resolution.EXTERNAL, edges.get(1).resolution());

        DependencyGraph graph = DependencyGraph.freeze("root", "c", files, edges);
        assertEquals(2, graph.outgoing(1).size());
        assertTrue(graph.outgoing(0).isEmpty());
        assertEquals(new DependencyGraph.GraphStats(2, 2, 1, 1, 0), graph.stats());
    }

    @Test
    void freeze_GraphIsReadOnly() {
        List<SourceFile> files = files("infra/service/svc_uart.h");
        DependencyGraph graph = DependencyGraph.freeze("root", "c", files, List.of());

        assertThrows(UnsupportedOperationException.class, () -> graph.files().clear());
        assertThrows(UnsupportedOperationException.class, () -> graph.edges().clear());
    }

    @Test
    void freeze_RejectsEdgesOutsideTheArena() {
        List<SourceFile> files = files("infra/service/svc_uart.h");
        DependencyEdge dangling = DependencyEdge.resolved(0, RawReference.of("x.h", "x.h", 1, false), 5, Role.CAPABILITY);

        assertThrows(IllegalArgumentException.class, () -> DependencyGraph.freeze("root", "c", files, List.of(dangling)));
    }

    private List<SourceFile> files(String... paths) {
        List<SourceFile> files = new ArrayList<>();
        for (String path : paths) {
            files.add(new SourceFile(files.size(), path, "c", classifier.classify(path).orElseThrow(),
                    List.of(), StructuralSignals.empty()));
        }
        return files;
    }
}
