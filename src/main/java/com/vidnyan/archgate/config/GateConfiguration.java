package com.vidnyan.archgate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.archgate.application.port.in.GateConfigurationException;
import com.vidnyan.archgate.application.port.out.SourceTreeWalker;
import com.vidnyan.archgate.application.port.out.SyntaxAdapter;
import com.vidnyan.archgate.application.service.AdapterInvoker;
import com.vidnyan.archgate.application.service.DocumentationHygieneChecker;
import com.vidnyan.archgate.application.service.SourceModelBuilder;
import com.vidnyan.archgate.application.service.SyntaxAdapterRegistry;
import com.vidnyan.archgate.domain.model.RoleClassifier;
import com.vidnyan.archgate.domain.rule.RuleCatalog;
import com.vidnyan.archgate.domain.rule.RuleEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration for the gate.
 * Wires the framework-free domain and application services.
 */
@Slf4j
@Configuration
public class GateConfiguration {

    /**
     * ObjectMapper for report serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleCatalog ruleCatalog() {
        return RuleCatalog.standard();
    }

    @Bean
    public RuleEngine ruleEngine(RuleCatalog catalog, GateProperties properties) {
        validate(properties);
        return new RuleEngine(catalog.rules(), properties.effectiveWorkerThreads());
    }

    @Bean
    public SyntaxAdapterRegistry syntaxAdapterRegistry(List<SyntaxAdapter> adapters) {
        return new SyntaxAdapterRegistry(adapters);
    }

    @Bean
    public AdapterInvoker adapterInvoker(GateProperties properties) {
        validate(properties);
        return new AdapterInvoker(properties.getAdapterTimeout(), properties.getAdapterMaxAttempts());
    }

    @Bean
    public SourceModelBuilder sourceModelBuilder(SyntaxAdapterRegistry registry, AdapterInvoker invoker,
                                                 SourceTreeWalker walker, GateProperties properties) {
        return new SourceModelBuilder(registry, invoker, walker, new RoleClassifier(),
                properties.effectiveWorkerThreads());
    }

    @Bean
    public DocumentationHygieneChecker documentationHygieneChecker() {
        return new DocumentationHygieneChecker();
    }

    /**
     * Log the rule catalog and adapters on startup.
     */
    @Bean
    public String logCatalog(RuleCatalog catalog, SyntaxAdapterRegistry registry) {
        log.info("Registered {} rules:", catalog.rules().size());
        catalog.rules().forEach(rule -> log.info("  - {} [{}]", rule.id(), rule.severity()));
        log.info("Registered {} syntax adapters:", registry.adapters().size());
        registry.adapters().forEach(adapter -> log.info("  - {} {}", adapter.dialectId(), adapter.fileExtensions()));
        return "catalog-logged";
    }

    static void validate(GateProperties properties) {
        if (properties.getWorkerThreads() < 0) {
            throw new GateConfigurationException("gate.worker-threads must not be negative");
        }
        if (properties.getAdapterMaxAttempts() < 1) {
            throw new GateConfigurationException("gate.adapter-max-attempts must be at least 1");
        }
        if (properties.getAdapterTimeout() == null || properties.getAdapterTimeout().isNegative()
                || properties.getAdapterTimeout().isZero()) {
            throw new GateConfigurationException("gate.adapter-timeout must be positive");
        }
    }
}
