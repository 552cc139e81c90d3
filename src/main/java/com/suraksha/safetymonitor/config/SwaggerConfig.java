package com.suraksha.safetymonitor.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Suraksha Safety Monitor API")
                        .description("Location ingest, safe-zone monitoring, incident lifecycle and real-time alert fan-out")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")))
                .components(new Components()
                        .addSecuritySchemes("userId", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(AuthInterceptor.USER_ID_HEADER))
                        .addSecuritySchemes("role", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(AuthInterceptor.ROLE_HEADER)))
                .addSecurityItem(new SecurityRequirement().addList("userId").addList("role"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
