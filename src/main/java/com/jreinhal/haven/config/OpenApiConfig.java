package com.jreinhal.haven.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI / Swagger UI at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:haven}")
    private String appName;

    @Bean
    public OpenAPI havenOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Haven Child Protection API")
                        .description("""
                                Incident reporting and case follow-up for SOS children's villages.

                                ## Authentication
                                Sign in through `POST /api/auth/sign-in` and send the returned token as
                                `Authorization: Bearer <token>`. Each endpoint lists the permissions it needs.
                                """)
                        .version("1.0.0"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("Session token from /api/auth/sign-in (" + appName + ")")))
                .security(List.of(new SecurityRequirement().addList("bearerAuth")))
                .servers(List.of(new Server().url("/").description("Current Server")));
    }
}
