package com.vidnyan.archgate.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RoleClassifierTest {

    private final RoleClassifier classifier = new RoleClassifier();

    @Test
    void classify_FeatureRolesTakeFeatureFromFolder() {
        Classification intent = classifier.classify("project/features/alpha/ida_alpha.c").orElseThrow();
        Classification interpretation = classifier.classify("project/features/alpha/prx_alpha_sensor.h").orElseThrow();
        Classification production = classifier.classify("project/features/beta/poi_beta.c").orElseThrow();

        assertEquals(Role.INTENT, intent.role());
        assertEquals("alpha", intent.feature());
        assertEquals("ida", intent.category());
        assertTrue(intent.projectScoped());
        assertNull(intent.namingIssue());

        assertEquals(Role.INTERPRETATION, interpretation.role());
        assertEquals("alpha", interpretation.feature());
        assertEquals(Role.PRODUCTION, production.role());
        assertEquals("beta", production.feature());
    }

    @Test
    void classify_InfrastructureRoles() {
        assertEquals(Role.CAPABILITY, classifier.classify("infra/service/svc_uart.h").orElseThrow().role());
        assertEquals(Role.PLATFORM, classifier.classify("infra/platform/hal/hal_gpio.c").orElseThrow().role());
        assertEquals(Role.PLATFORM, classifier.classify("infra/platform/bsp/bsp_board.c").orElseThrow().role());
        assertEquals(Role.CAPABILITY, classifier.classify("deps/middleware/rtos/mdw_queue.c").orElseThrow().role());
        assertEquals(Role.DATA_PLANE, classifier.classify("project/datastreams/stm_telemetry.h").orElseThrow().role());

        Classification service = classifier.classify("infra/service/svc_uart.h").orElseThrow();
        assertEquals("", service.feature());
        assertFalse(service.projectScoped());
    }

    @Test
    void classify_ContractVocabularyLivesInBootstrap() {
        Classification contract = classifier.classify("infra/bootstrap/cfg_core.h").orElseThrow();

        assertEquals(Role.RESOURCE, contract.role());
        assertTrue(contract.contractVocabulary());
        assertEquals(RoleClassifier.CORE_FEATURE, contract.feature());

        Classification misplaced = classifier.classify("project/config/cfg_core.h").orElseThrow();
        assertEquals(Role.UNCLASSIFIED, misplaced.role());
        assertEquals(Classification.IssueKind.MISPLACED, misplaced.namingIssue().kind());
    }

    @Test
    void classify_ResourcePlacement() {
        Classification featureConfig = classifier.classify("project/features/alpha/cfg_alpha.h").orElseThrow();
        assertEquals(Role.RESOURCE, featureConfig.role());
        assertEquals("alpha", featureConfig.feature());

        assertEquals(Role.RESOURCE, classifier.classify("project/config/cfg_project.h").orElseThrow().role());
        assertEquals(Role.UNCLASSIFIED, classifier.classify("project/features/alpha/cfg_project.h").orElseThrow().role());
        assertEquals(Role.UNCLASSIFIED, classifier.classify("infra/service/db_records.h").orElseThrow().role());

        // Resources of a vendored, non-fractal unit are exempt from placement
        assertEquals(Role.RESOURCE, classifier.classify("deps/extern/lwip/cfg_lwip.h").orElseThrow().role());
    }

    @Test
    void classify_NestedArchitectureUnit() {
        Classification nested = classifier.classify("deps/extern/motor/infra/service/svc_pwm.c").orElseThrow();
        assertEquals(Role.CAPABILITY, nested.role());

        Classification nestedFeature = classifier.classify("deps/extern/motor/project/features/speed/ida_speed.c").orElseThrow();
        assertEquals(Role.INTENT, nestedFeature.role());
        assertEquals("speed", nestedFeature.feature());
    }

    @Test
    void classify_MisplacedFileIsNamingInvalid() {
        Classification misplaced = classifier.classify("src/ida_alpha.c").orElseThrow();

        assertEquals(Role.UNCLASSIFIED, misplaced.role());
        assertEquals(Classification.IssueKind.MISPLACED, misplaced.namingIssue().kind());
        assertTrue(misplaced.namingIssue().message().contains("project/features/"));

        assertEquals(Role.UNCLASSIFIED, classifier.classify("infra/service/hal_gpio.c").orElseThrow().role());
    }

    @Test
    void classify_UnknownPrefixInsideManagedFolderIsNamingInvalid() {
        Classification unknown = classifier.classify("project/features/alpha/helpers.c").orElseThrow();

        assertEquals(Role.UNCLASSIFIED, unknown.role());
        assertEquals(Classification.IssueKind.UNKNOWN_PREFIX, unknown.namingIssue().kind());
    }

    @Test
    void classify_UnknownPrefixElsewhereIsExcluded() {
        assertEquals(Optional.empty(), classifier.classify("tools/generator.c"));
        assertEquals(Optional.empty(), classifier.classify("main.c"));
    }

    @Test
    void classify_ReservedLayoutPrefix() {
        Classification reserved = classifier.classify("infra/inf_board.c").orElseThrow();

        assertEquals(Role.UNCLASSIFIED, reserved.role());
        assertEquals(Classification.IssueKind.RESERVED_PREFIX, reserved.namingIssue().kind());
    }

    @Test
    void classify_LegacyPathIsClassifiedByPrefixOnly() {
        Classification legacy = classifier.classify("platform/hal_gpio.c").orElseThrow();
        assertEquals(Role.PLATFORM, legacy.role());
        assertEquals(LegacyLayout.PLATFORM, legacy.legacyLayout());
        assertNull(legacy.namingIssue());

        Classification legacyFeature = classifier.classify("features/alpha/ida_alpha.c").orElseThrow();
        assertEquals(Role.INTENT, legacyFeature.role());
        assertEquals("alpha", legacyFeature.feature());
        assertEquals(LegacyLayout.FEATURES, legacyFeature.legacyLayout());
    }

    @Test
    void classify_UnprefixedFileUnderLegacyFolderStaysInScope() {
        Classification module = classifier.classify("modules/uart/uart_driver.c").orElseThrow();
        assertEquals(Role.UNCLASSIFIED, module.role());
        assertEquals(LegacyLayout.MODULES, module.legacyLayout());
        assertNull(module.namingIssue());

        Classification coreConfig = classifier.classify("core/config/app_config.h").orElseThrow();
        assertEquals(LegacyLayout.CORE_CONFIG, coreConfig.legacyLayout());
        assertEquals("", coreConfig.feature());
    }

    @Test
    void classify_FeatureFolderMustSitAtUnitRoot() {
        Classification buried = classifier.classify("src/project/features/alpha/ida_alpha.c").orElseThrow();
        assertEquals(Role.UNCLASSIFIED, buried.role());
        assertEquals(Classification.IssueKind.MISPLACED, buried.namingIssue().kind());

        Classification buriedInUnit = classifier.classify("deps/extern/motor/lib/project/features/speed/ida_speed.c")
                .orElseThrow();
        assertEquals(Role.UNCLASSIFIED, buriedInUnit.role());
    }

    @Test
    void classify_IsCaseInsensitiveAndSeparatorAgnostic() {
        Classification windows = classifier.classify("project\\features\\alpha\\IDA_Alpha.C").orElseThrow();

        assertEquals(Role.INTENT, windows.role());
        assertEquals("alpha", windows.feature());
    }

    @Test
    void classify_IsDeterministic() {
        String path = "project/features/alpha/poi_alpha_motor.c";
        assertEquals(classifier.classify(path), classifier.classify(path));
    }
}
