package com.al.medreportz.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 * Swagger UI: /swagger-ui.html, OpenAPI JSON: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:medreportz}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Turns the plain text of a medical report (OCR, PDF or word-processor output)
                                                                into a structured record.

                                                                ## Features
                                                                - **Patient demographics**: name, age, gender
                                                                - **Vital signs**: blood pressure, heart rate, respiratory rate, temperature, SpO2
                                                                - **Lab results**: alias resolution and Low / Normal / High classification against reference intervals
                                                                - **FHIR R4 export** of the extracted record
                                                                - **Batch extraction** in parallel
                                                                """))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Extraction")
                                                                .description("Report extraction endpoints"),
                                                new Tag().name("Reference")
                                                                .description("Active reference intervals")));
        }
}
