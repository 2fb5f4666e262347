package com.demo.multisig.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI multiSigOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("Multi-Sig Coordinator API")
                .description("Proposals, signatures, validators and notification sync. Caller identity in X-User-Id.")
                .version("v1"));
    }
}
