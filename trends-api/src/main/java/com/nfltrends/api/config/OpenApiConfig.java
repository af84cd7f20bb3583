package com.nfltrends.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI nflTrendsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("NFL Trends API")
                        .description("Filtered queries over historical NFL games, betting trends and weekly trends. " +
                                "Repeated weekly trends queries and the upcoming games listing are served from cache.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("NFL Trends")
                                .email("admin@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Dev")
                ));
    }
}
