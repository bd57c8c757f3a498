package com.jreinhal.tieredrag.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Interactive API documentation at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:tiered-rag}")
    private String appName;

    @Bean
    public OpenAPI tieredRagOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tiered RAG API")
                        .version("1.0.0")
                        .description("""
                                Knowledge-base management, quality-driven document extraction and
                                hybrid (dense + sparse) retrieval with answer generation.
                                """))
                .servers(List.of(new Server().url("/").description(appName)))
                .tags(List.of(
                        new Tag().name("Knowledge Bases").description("Create, update and delete knowledge bases"),
                        new Tag().name("Documents").description("Document ingestion and management"),
                        new Tag().name("Query").description("Search, routing and chat"),
                        new Tag().name("Reasoning").description("Decision traces")
                ));
    }
}
