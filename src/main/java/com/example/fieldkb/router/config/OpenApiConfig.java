package com.example.fieldkb.router.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "KB Router API",
        version = "v1",
        description = "Coverage-aware routing of field requests and knowledge gap reconciliation."
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
            .title("KB Router API")
            .version("v1")
            .description("Route requests by knowledge base coverage; list and resolve recorded gaps."));
  }

  @Bean
  public GroupedOpenApi routerApi() {
    return GroupedOpenApi.builder()
        .group("router")
        .packagesToScan("com.example.fieldkb.router.controller")
        .pathsToMatch("/v1/**")
        .build();
  }

  @Bean
  public GroupedOpenApi actuatorApi() {
    return GroupedOpenApi.builder()
        .group("actuator")
        .pathsToMatch("/actuator/**")
        .build();
  }
}
