package com.prospectpulse.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI prospectPulseOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ProspectPulse API")
                        .description("Workspace configuration and lead enrichment jobs coordinated through a shared key-value store")
                        .version("0.1.0"))
                .components(new Components()
                        .addSecuritySchemes(ApiTokenAuthFilter.API_TOKEN_HEADER, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(ApiTokenAuthFilter.API_TOKEN_HEADER)))
                .addSecurityItem(new SecurityRequirement().addList(ApiTokenAuthFilter.API_TOKEN_HEADER))
                .servers(List.of(
                        new Server().url("http://localhost:8000").description("Development Server")));
    }
}
