package com.oraclex.relay.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI relayOpenApi(RelayProperties relayProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title(relayProperties.getName() + " API")
                        .description("Price/analysis merge cache and signal approval queue")
                        .version(relayProperties.getVersion()));
    }
}
