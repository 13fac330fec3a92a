package com.openrangelabs.ingestor.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation for the data ingestor API.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Configuration
public class SwaggerConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI dataIngestorOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server")))
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("JWT token with a roles claim")));
    }

    private Info apiInfo() {
        return new Info()
                .title("Data Ingestor API")
                .description("""
                # Data Ingestor

                Pluggable connectors extract rows from databases and file repositories. Jobs run
                them on cron schedules, transform the rows with ordered rules and hand them on.

                ## Key Features

                * **Connector registry**: discover connectors, inspect their parameters, test connections
                * **Scheduled jobs**: cron triggers, immediate runs, automatic pause after repeated failures
                * **Credential store**: AES encrypted secrets with rotation history

                Credential values are never returned in API responses.
                """)
                .version("1.0.0")
                .contact(new Contact()
                        .name("OpenRange Labs Development Team")
                        .email("dev@openrangelabs.com")
                        .url("https://openrangelabs.com"));
    }
}
