package com.vidnyan.archgate.adapter.out.syntax;

import com.vidnyan.archgate.domain.model.RawReference;
import com.vidnyan.archgate.domain.model.RestrictedCall;
import com.vidnyan.archgate.domain.model.StructuralSignals;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VisualBasicSyntaxAdapterTest {

    private final VisualBasicSyntaxAdapter adapter = new VisualBasicSyntaxAdapter();

    private static final String INTENT = String.join("\r\n",
            "Imports System.IO",
            "Imports Uart = Company.Infra.svc_uart",
            "' Imports Commented.Out",
            "",
            "Public Class ida_alpha",
            "    Public Sub Run()",
            "        Dim reading = prx_alpha.Read()",
            "        If reading > 10 Then",
            "            poi_alpha.Drive(reading) ' drive it",
            "        End If",
            "    End Sub",
            "End Class");

    @Test
    void extract_ShouldReadImportsAndLayerClassNames() {
        List<RawReference> references = adapter.extract(INTENT, ".vb").references();

        assertEquals(List.of("System.IO", "Company.Infra.svc_uart", "prx_alpha", "poi_alpha"),
                references.stream().map(RawReference::raw).toList());
        assertEquals("svc_uart", references.get(1).name());
        assertEquals(2, references.get(1).line());
        assertEquals(7, references.get(2).line());
        assertEquals(9, references.get(3).line());
    }

    @Test
    void extract_ShouldIgnoreLayerNamesInCommentsStringsAndOwnDeclaration() {
        String source = String.join("\n",
                "Public Class poi_alpha",
                "    ' ida_alpha is upstream",
                "    Sub Log()",
                "        Console.WriteLine(\"prx_beta\")",
                "    End Sub",
                "End Class");

        assertTrue(adapter.extract(source, ".vb").references().isEmpty());
    }

    @Test
    void extract_ShouldMarkRestrictedCalls() {
        String source = String.join("\n",
                "Public Class ida_alpha",
                "    Sub Run()",
                "        Thread.Sleep(100)",
                "        MessageBox.Show(\"done\")",
                "        Log(\"Process.Start(x)\")",
                "    End Sub",
                "End Class");

        List<RestrictedCall> calls = adapter.extract(source, ".vb").restrictedCalls();

        assertEquals(List.of("Thread.Sleep", "MessageBox.Show"), calls.stream().map(RestrictedCall::api).toList());
        assertEquals(3, calls.get(0).line());
    }

    @Test
    void extract_ShouldCountOnlyMethodBodies() {
        StructuralSignals signals = adapter.extract(INTENT, ".vb").signals();

        assertTrue(signals.implementation());
        assertEquals(4, signals.codeLines());
        assertEquals(1, signals.branchCount());
        assertEquals(2, signals.callCount());
    }

    @Test
    void extract_ShouldExcludeMeFromFieldAccess() {
        String source = String.join("\n",
                "Module poi_alpha",
                "    Sub Apply()",
                "        If sensor.Value > Me.Limit Then",
                "        End If",
                "    End Sub",
                "End Module");

        assertEquals(1, adapter.extract(source, ".vb").signals().externalFieldAccessCount());
    }

    @Test
    void stripComment_ShouldKeepApostropheInsideString() {
        assertEquals("x = \"it's\" ", VisualBasicSyntaxAdapter.stripComment("x = \"it's\" ' note"));
        assertEquals("", VisualBasicSyntaxAdapter.stripComment("  REM old code"));
    }
}
