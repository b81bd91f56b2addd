package com.vidnyan.archgate.adapter.out.syntax;

import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.RestrictedCall;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import com.vidnyan.archgate.domain.model.SyntaxExtraction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CSharpSyntaxAdapterTest {

    private final CSharpSyntaxAdapter adapter = new CSharpSyntaxAdapter();

    private static final String INTENT = String.join("\n",
            "using System;",
            "using static System.Math;",
            "using Uart = Company.Infra.svc_uart;",
            "global using System.Linq;",
            "// using Commented.Out;",
            "",
            "namespace Company.Features.Alpha",
            "{",
            "    public class ida_alpha",
            "    {",
            "        public void Run()",
            "        {",
            "            var reading = prx_alpha.Read();",
            "            if (reading > 10)",
            "            {",
            "                poi_alpha.Drive(reading);",
            "            }",
            "        }",
            "    }",
            "}");

    @Test
    void extract_ShouldReadUsingDirectivesAndLayerClassNames() {
        List<RawReference> references = adapter.extract(INTENT, ".cs").references();

        assertEquals(List.of("System", "System.Math", "Company.Infra.svc_uart", "System.Linq", "prx_alpha", "poi_alpha"),
                references.stream().map(RawReference::raw).toList());
        assertEquals(List.of(1, 2, 3, 4, 13, 16), references.stream().map(RawReference::line).toList());

        RawReference alias = references.get(2);
        assertEquals("svc_uart", alias.name());
        assertEquals("Company/Infra/svc_uart", alias.pathHint());
    }

    @Test
    void extract_ShouldCountBranchesAndCalls() {
        SyntaxExtraction extraction = adapter.extract(INTENT, ".cs");
        StructuralSignals signals = extraction.signals();

        assertTrue(signals.implementation());
        assertEquals(1, signals.branchCount());
        assertEquals(2, signals.callCount());
    }

    @Test
    void extract_ShouldExcludeSelfFieldAccess() {
        String source = String.join("\n",
                "class poi_alpha",
                "{",
                "    void Apply()",
                "    {",
                "        if (sensor.Value > limit && this.enabled)",
                "        {",
                "        }",
                "    }",
                "}");

        StructuralSignals signals = adapter.extract(source, ".cs").signals();

        assertEquals(1, signals.externalFieldAccessCount());
    }

    @Test
    void extract_ShouldNotTreatUsingStatementAsReference() {
        String source = String.join("\n",
                "class prx_alpha",
                "{",
                "    void Read()",
                "    {",
                "        using (var port = Open())",
                "        {",
                "        }",
                "    }",
                "}");

        assertTrue(adapter.extract(source, ".cs").references().isEmpty());
    }

    @Test
    void extract_ShouldReferenceLayerClassesUsedInCode() {
        String source = String.join("\n",
                "class poi_alpha",
                "{",
                "    void Apply()",
                "    {",
                "        var i = new ida_alpha(); i.Run(); prx_beta.Read();",
                "        var again = new ida_alpha();",
                "        // prx_gamma.Read();",
                "        Log(\"poi_delta\");",
                "        poi_alpha.Helper();",
                "    }",
                "}");

        List<RawReference> references = adapter.extract(source, ".cs").references();

        assertEquals(List.of("ida_alpha", "prx_beta", "ida_alpha"), references.stream().map(RawReference::raw).toList());
        assertEquals(List.of(5, 5, 6), references.stream().map(RawReference::line).toList());
        assertEquals("prx_beta", references.get(1).name());
    }

    @Test
    void extract_ShouldMarkRestrictedCalls() {
        String source = String.join("\n",
                "class ida_alpha",
                "{",
                "    void Run()",
                "    {",
                "        Thread.Sleep(10);",
                "        control.BeginInvoke(update);",
                "        Process.Start(\"notepad\");",
                "        Log(\"MessageBox.Show(x)\");",
                "    }",
                "}");

        List<RestrictedCall> calls = adapter.extract(source, ".cs").restrictedCalls();

        assertEquals(List.of("Thread.Sleep", ".Invoke/.BeginInvoke", "Process.Start"),
                calls.stream().map(RestrictedCall::api).toList());
        assertEquals(List.of(5, 6, 7), calls.stream().map(RestrictedCall::line).toList());
    }

    @Test
    void extract_ShouldFailOnUnterminatedVerbatimString() {
        String source = String.join("\n",
                "class prx_alpha",
                "{",
                "    string path = @\"C:\\data",
                "}");

        SyntaxExtraction extraction = adapter.extract(source, ".cs");

        assertTrue(extraction.signals().parseFailure());
        assertTrue(extraction.signals().parseError().contains("verbatim string"));
    }

    @Test
    void extract_ShouldAcceptMultilineVerbatimString() {
        String source = String.join("\n",
                "class prx_alpha",
                "{",
                "    string text = @\"first \"\"quoted\"\" {",
                "second\";",
                "}");

        assertFalse(adapter.extract(source, ".cs").signals().parseFailure());
    }

    @Test
    void extract_ShouldNotTreatInterfaceOnlyFileAsImplementation() {
        String source = "namespace A { public interface ida_alpha { void Run(); } }";

        assertFalse(adapter.extract(source, ".cs").signals().implementation());
    }

    @Test
    void forbiddenIntentNamespaces_ShouldCoverIoAndUi() {
        assertTrue(adapter.forbiddenIntentNamespaces().contains("System.IO"));
        assertTrue(adapter.forbiddenIntentNamespaces().contains("System.Windows.Forms"));
    }
}
