package com.projectedjournal.batchprocessor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configures the global SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI journalOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Projected Journal Batch API")
                        .description("""
                                Builds a 13-week projected cash journal from four workbooks.

                                **Inputs:**
                                - AP/AR Cash Grid — wide (13 weekly columns) or event-list layout, detected automatically
                                - Beginning Balance Sheet
                                - GAAP Mapping
                                - Cashflow Mapping

                                **Output:** a styled `.xlsx` journal with the fixed 17-column schema, all amounts in USD.

                                Jobs run asynchronously; poll the status endpoint with the returned `jobExecutionId`.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
