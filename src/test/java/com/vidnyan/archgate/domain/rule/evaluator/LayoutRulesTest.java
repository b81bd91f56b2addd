package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.model.StructuralSignals;
import com.vidnyan.archgate.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayoutRulesTest {

    @Test
    void legacyLayout_ShouldReportEachLegacyFileOnce() {
        GraphFixture fixture = new GraphFixture()
                .file("platform/hal_gpio.c")
                .file("features/alpha/ida_alpha.c")
                .file("infra/platform/hal/hal_uart.c");

        List<Finding> legacy = fixture.inspect(new LegacyLayoutRule());
        List<Finding> naming = fixture.inspect(new NamingInvalidRule());

        assertEquals(2, legacy.size());
        assertEquals("platform/hal_gpio.c", legacy.get(0).path());
        assertTrue(legacy.get(0).message().contains("infra/platform/"));
        assertTrue(legacy.get(1).message().contains("project/features/"));
        assertTrue(naming.isEmpty(), "legacy paths are not reported as misplaced too");
    }

    @Test
    void legacyLayout_ShouldReportUnprefixedFilesUnderLegacyFolders() {
        GraphFixture fixture = new GraphFixture()
                .file("project/features/alpha/prx_alpha.c")
                .file("core/config/app_config.h")
                .file("modules/uart/uart_driver.c")
                .file("tools/generator.c");

        List<Finding> legacy = fixture.inspect(new LegacyLayoutRule());
        List<Finding> naming = fixture.inspect(new NamingInvalidRule());

        assertEquals(2, legacy.size());
        assertEquals("core/config/app_config.h", legacy.get(0).path());
        assertTrue(legacy.get(0).message().contains("infra/bootstrap/cfg_core"));
        assertEquals("modules/uart/uart_driver.c", legacy.get(1).path());
        assertTrue(legacy.get(1).message().contains("infra/ and deps/"));
        assertTrue(naming.isEmpty());
    }

    @Test
    void reservedPrefix_ShouldBeReportedAsMisuse() {
        List<Finding> findings = new GraphFixture()
                .file("infra/bootstrap/inf_boot.c")
                .file("project/features/alpha/INF_helper.c")
                .inspect(new ReservedPrefixMisuseRule());

        assertEquals(2, findings.size());
        assertEquals("reserved-prefix-misuse", findings.get(0).ruleId());
    }

    @Test
    void parseFailure_ShouldBlockWithError() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/prx_alpha.c",
                        StructuralSignals.failure("unbalanced braces"))
                .file("project/features/alpha/poi_alpha.c")
                .inspect(new ParseFailureRule());

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).isError());
        assertTrue(findings.get(0).message().endsWith("unbalanced braces"));
    }

    @Test
    void dependencyPathInclude_ShouldFlagFeatureRolesOnly() {
        GraphFixture fixture = new GraphFixture()
                .file("project/features/alpha/poi_alpha.c",
                        "../../../deps/extern/motor/svc_motor.h", "deps\\vendor\\lib.h", "mydeps/lib.h")
                .file("infra/service/svc_uart.c", "../../deps/extern/uart/uart.h");

        List<Finding> findings = fixture.inspect(new DependencyPathIncludeRule());

        assertEquals(2, findings.size(), findings::toString);
        assertEquals(List.of(1, 2), findings.stream().map(Finding::line).toList());
    }

    @Test
    void dependencyPathInclude_ShouldIgnoreSystemReferences() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/poi_alpha.c", StructuralSignals.empty(),
                        List.of(GraphFixture.systemInclude("deps/stdint.h", 1)))
                .inspect(new DependencyPathIncludeRule());

        assertTrue(findings.isEmpty());
    }
}
