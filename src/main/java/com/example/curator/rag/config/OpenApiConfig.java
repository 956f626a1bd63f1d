package com.example.curator.rag.config;

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
        title = "Curator RAG API",
        version = "v1",
        description = "Knowledge-base routing and similarity retrieval for the curator agents."
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
            .title("Curator RAG API")
            .version("v1")
            .description("Swagger UI for the retrieval endpoints.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi ragApi() {
    return GroupedOpenApi.builder()
        .group("rag")
        .packagesToScan("com.example.curator.rag.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
