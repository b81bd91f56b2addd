package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectionViolationRuleTest {

    private final DirectionViolationRule rule = new DirectionViolationRule();

    @Test
    void intentReferencingOwnFeatureAndContractIsAllowed() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/ida_alpha.c", "prx_alpha.h", "poi_alpha.h", "cfg_core.h")
                .file("project/features/alpha/prx_alpha.h")
                .file("project/features/alpha/poi_alpha.h")
                .file("infra/bootstrap/cfg_core.h")
                .inspect(rule);

        assertTrue(findings.isEmpty(), findings::toString);
    }

    @Test
    void intentReferencingCapabilityIsLeftToContainmentRule() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/ida_alpha.c", "svc_uart.h", "hal_gpio.h")
                .file("infra/service/svc_uart.h")
                .inspect(rule);

        assertTrue(findings.isEmpty(), findings::toString);
    }

    @Test
    void intentReferencingDataPlaneIsViolation() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/ida_alpha.c", "stm_telemetry.h")
                .file("project/datastreams/stm_telemetry.h")
                .inspect(rule);

        assertEquals(1, findings.size());
        assertEquals("direction-violation", findings.get(0).ruleId());
        assertEquals(1, findings.get(0).line());
    }

    @Test
    void productionMustNotReferenceInterpretation() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/poi_alpha.c", "prx_alpha.h")
                .file("project/features/alpha/prx_alpha.h")
                .inspect(rule);

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("Production must not reference Interpretation"));
    }

    @Test
    void interpretationMayUseLowerRoles() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/prx_alpha.c", "poi_alpha.h", "svc_uart.h", "stm_telemetry.h",
                        "cfg_alpha.h")
                .file("project/features/alpha/poi_alpha.h")
                .file("project/features/alpha/cfg_alpha.h")
                .file("infra/service/svc_uart.h")
                .file("project/datastreams/stm_telemetry.h")
                .inspect(rule);

        assertTrue(findings.isEmpty(), findings::toString);
    }

    @Test
    void capabilityMustNotReferenceUpperRolesOrProjectResources() {
        List<Finding> findings = new GraphFixture()
                .file("infra/service/svc_uart.c", "poi_alpha.h", "cfg_project.h", "hal_uart.h", "cfg_core.h")
                .file("project/features/alpha/poi_alpha.h")
                .file("project/config/cfg_project.h")
                .file("infra/platform/hal/hal_uart.h")
                .file("infra/bootstrap/cfg_core.h")
                .inspect(rule);

        assertEquals(2, findings.size(), findings::toString);
        assertEquals(1, findings.get(0).line());
        assertEquals(2, findings.get(1).line());
    }

    @Test
    void boardSupportMustNotReferenceHal() {
        List<Finding> findings = new GraphFixture()
                .file("infra/platform/bsp/bsp_board.c", "hal_gpio.h")
                .file("infra/platform/hal/hal_gpio.h")
                .file("infra/platform/hal/hal_gpio.c", "bsp_board.h")
                .file("infra/platform/bsp/bsp_board.h")
                .inspect(rule);

        assertEquals(1, findings.size());
        assertEquals("infra/platform/bsp/bsp_board.c", findings.get(0).path());
    }

    @Test
    void unresolvedReferenceIsJudgedByName() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/poi_alpha.c", "ida_alpha.h", "poi_beta.h", "poi_alpha_pwm.h")
                .inspect(rule);

        assertEquals(2, findings.size(), findings::toString);
        assertTrue(findings.stream().anyMatch(f -> f.message().endsWith("ida_alpha.h")));
        assertTrue(findings.stream().anyMatch(f -> f.message().endsWith("poi_beta.h")));
    }

    @Test
    void ambiguousReferenceIsViolationOnlyWhenEveryCandidateViolates() {
        List<Finding> mixed = new GraphFixture()
                .file("project/features/alpha/poi_alpha.c", "poi_shared.h")
                .file("project/features/alpha/poi_shared.h")
                .file("project/features/beta/poi_shared.h")
                .inspect(rule);
        assertTrue(mixed.isEmpty(), mixed::toString);

        List<Finding> allForeign = new GraphFixture()
                .file("project/features/alpha/poi_alpha.c", "poi_shared.h")
                .file("project/features/beta/poi_shared.h")
                .file("project/features/gamma/poi_shared.h")
                .inspect(rule);
        assertEquals(1, allForeign.size());
        assertTrue(allForeign.get(0).message().contains("all 2 candidates"));
    }

    @Test
    void unclassifiedFilesAreNotEvaluated() {
        List<Finding> findings = new GraphFixture()
                .file("src/poi_alpha.c", "ida_alpha.h")
                .inspect(rule);

        assertTrue(findings.isEmpty());
    }
}
