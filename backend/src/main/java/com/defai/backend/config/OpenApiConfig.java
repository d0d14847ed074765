package com.defai.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI oracleOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("DeFAI Oracle Signal API")
                        .description("Token sentiment, snipe signals and engine administration")
                        .version("v1"));
    }
}
