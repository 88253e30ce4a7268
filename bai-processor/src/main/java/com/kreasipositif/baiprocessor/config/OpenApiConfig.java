package com.kreasipositif.baiprocessor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
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
    public OpenAPI baiProcessorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("BAI Processor API")
                        .description("""
                                Batch service for daily BAI2 bank files.
                                
                                **Jobs:**
                                - `bankFileIngestJob` — decodes a BAI2 file into a balances CSV and a transactions CSV.
                                - `cashApplicationJob` — matches transaction credits to open invoices and appends the result to the cash-application CSV.
                                
                                **Matching:** amount (50 exact / 30 within 1%) plus customer-name similarity (up to 50).
                                A match is applied at a score of **60** or more.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kreasi Positif")
                                .url("https://github.com/kreasipositif"))
                        .license(new License()
                                .name("MIT")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
