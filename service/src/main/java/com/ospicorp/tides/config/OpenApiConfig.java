package com.ospicorp.tides.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Tide Validation API")
            .version("v1")
            .description("Harmonic tide reconstruction and validation of digitized tide records")
            .contact(new Contact().name("Tide Records Team").email("tides-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
