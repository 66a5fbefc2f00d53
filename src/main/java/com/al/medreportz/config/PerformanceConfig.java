package com.al.medreportz.config;

import ca.uhn.fhir.context.FhirContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Singleton FHIR context. It is thread-safe and expensive to create (~1-2 seconds),
 * so it is built once.
 */
@Configuration
public class PerformanceConfig {

    @Bean
    public FhirContext fhirContext() {
        FhirContext ctx = FhirContext.forR4();
        ctx.getParserOptions().setStripVersionsFromReferences(false);
        return ctx;
    }
}
