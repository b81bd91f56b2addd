package com.vidnyan.archgate.application.service;

import com.vidnyan.archgate.adapter.out.syntax.CIncludeSyntaxAdapter;
import com.vidnyan.archgate.adapter.out.syntax.CSharpSyntaxAdapter;
import com.vidnyan.archgate.adapter.out.syntax.JavaParserSyntaxAdapter;
import com.vidnyan.archgate.adapter.out.syntax.VisualBasicSyntaxAdapter;
import com.vidnyan.archgate.application.port.in.GateConfigurationException;
import com.vidnyan.archgate.application.port.out.SyntaxAdapter;
import com.vidnyan.archgate.domain.model.SyntaxExtraction;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxAdapterRegistryTest {

    private final SyntaxAdapterRegistry registry = new SyntaxAdapterRegistry(List.of(
            new VisualBasicSyntaxAdapter(), new CIncludeSyntaxAdapter(),
            new JavaParserSyntaxAdapter(), new CSharpSyntaxAdapter()));

    @Test
    void adaptersAreOrderedByDialect() {
        assertEquals(List.of("c", "csharp", "java", "vb"),
                registry.adapters().stream().map(SyntaxAdapter::dialectId).toList());
    }

    @Test
    void dialectIsChosenByExtension() {
        assertEquals("c", registry.forFile(Path.of("a/poi_alpha.H")).orElseThrow().dialectId());
        assertEquals("csharp", registry.forFile(Path.of("ida_alpha.cs")).orElseThrow().dialectId());
        assertEquals("vb", registry.forFile(Path.of("ida_alpha.vb")).orElseThrow().dialectId());
        assertTrue(registry.forFile(Path.of("README.md")).isEmpty());
        assertTrue(registry.forFile(Path.of("Makefile")).isEmpty());
    }

    @Test
    void extensionOf_ShouldLowerCaseWithDot() {
        assertEquals(".cpp", SyntaxAdapterRegistry.extensionOf(Path.of("x/y/svc_uart.CPP")));
        assertEquals("", SyntaxAdapterRegistry.extensionOf(Path.of(".gitignore")));
    }

    @Test
    void duplicateExtensionIsConfigurationError() {
        SyntaxAdapter clash = new SyntaxAdapter() {
            @Override
            public String dialectId() {
                return "header";
            }

            @Override
            public Set<String> fileExtensions() {
                return Set.of(".h");
            }

            @Override
            public SyntaxExtraction extract(String text, String dialectHint) {
                return SyntaxExtraction.failed("unused");
            }
        };

        assertThrows(GateConfigurationException.class,
                () -> new SyntaxAdapterRegistry(List.of(new CIncludeSyntaxAdapter(), clash)));
    }
}
