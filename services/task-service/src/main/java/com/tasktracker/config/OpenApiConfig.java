package com.tasktracker.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI description served at /v3/api-docs, with Swagger UI at /swagger-ui.html.
 *
 * Declares the bearer JWT scheme so the UI can send the token returned by
 * POST /api/auth/login.
 */
@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI taskTrackerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Task Tracker API")
                        .version("v1")
                        .description("Per-user task management behind JWT bearer authentication"))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("Token from POST /api/auth/login or /api/auth/register")))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }
}
