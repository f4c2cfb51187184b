package com.alphatransformer.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI alphaTransformerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("AlphaTransformer Market Data API")
                        .description("Cached klines, multi-timeframe indicators and stream diagnostics")
                        .version("1.0"));
    }
}
