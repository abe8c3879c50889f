package com.example.interactivecrop.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI interactiveCropApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Interactive Crop API")
                        .description("Selection editing and crop decisions for paused computation steps.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Interactive Crop")));
    }
}
