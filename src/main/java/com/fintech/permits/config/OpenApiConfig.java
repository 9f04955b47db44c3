package com.fintech.permits.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI permitPipelineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Permit Payment Pipeline API")
                        .description("Gateway webhooks, payment recovery, permit generation queue, queue metrics and expiration reminders for vehicle permit applications.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Permits Platform Team")
                                .email("permits@example.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
