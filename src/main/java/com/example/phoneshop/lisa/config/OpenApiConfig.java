package com.example.phoneshop.lisa.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "Lisa API",
        version = "v1",
        description = "Phone-shop assistant: chat, streamed chat and tool endpoints."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("Lisa API")
            .version("v1")
            .description("Swagger UI for the chat and tool endpoints.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi chatApi() {
    return GroupedOpenApi.builder()
        .group("chat")
        .packagesToScan("com.example.phoneshop.lisa.controller")
        .pathsToMatch("/chat/**", "/chat", "/health")
        .build();
  }

  @Bean
  public GroupedOpenApi toolsApi() {
    return GroupedOpenApi.builder()
        .group("tools")
        .packagesToScan("com.example.phoneshop.lisa.controller")
        .pathsToMatch("/v1/tools/**", "/v1/tools")
        .build();
  }
}
