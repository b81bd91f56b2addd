package com.vidnyan.archgate.domain.rule.evaluator;

import com.vidnyan.archgate.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamingInvalidRuleTest {

    private final NamingInvalidRule rule = new NamingInvalidRule();

    @Test
    void unknownPrefixInManagedFolderIsReported() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/helper.c")
                .inspect(rule);

        assertEquals(1, findings.size());
        assertEquals(Finding.NO_LINE, findings.get(0).line());
        assertTrue(findings.get(0).message().contains("helper.c"));
    }

    @Test
    void misplacedRoleFileIsReported() {
        List<Finding> findings = new GraphFixture()
                .file("infra/service/ida_alpha.c")
                .file("project/features/alpha/svc_uart.c")
                .inspect(rule);

        assertEquals(2, findings.size());
        assertTrue(findings.get(0).message().contains("project/features/"));
        assertTrue(findings.get(1).message().contains("infra/service/"));
    }

    @Test
    void reservedPrefixIsLeftToItsOwnRule() {
        List<Finding> findings = new GraphFixture()
                .file("infra/bootstrap/inf_boot.c")
                .inspect(rule);

        assertTrue(findings.isEmpty());
    }

    @Test
    void wellPlacedFilesPass() {
        List<Finding> findings = new GraphFixture()
                .file("project/features/alpha/ida_alpha.c")
                .file("infra/platform/bsp/bsp_board.c")
                .file("deps/middleware/rtos/mdw_rtos.c")
                .inspect(rule);

        assertTrue(findings.isEmpty(), findings::toString);
    }
}
