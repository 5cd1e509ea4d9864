package com.example.studydesign.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI studyDesignOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Study Design Service API")
                        .version("0.1.0")
                        .description("""
                                Plans bioequivalence studies from published pharmacokinetic data.

                                ## Features
                                - Literature search and PK parameter extraction
                                - Sample size, enrollment and washout for 2x2 crossover and replicate designs
                                - Advisory regulatory rule check (EAEU Decision 85 / EMA)
                                - Study synopsis rendering

                                ## Pipeline
                                `searching` → `searching_completed` → `design_completed` → `completed`.
                                Runs are asynchronous: `POST /api/v1/projects` answers 202, then poll
                                `GET /api/v1/projects/{id}`. Failed attempts can be retried.

                                Results are advisory and do not guarantee regulatory acceptance.
                                """)
                        .contact(new Contact()
                                .name("Study Design Team")));
    }
}
