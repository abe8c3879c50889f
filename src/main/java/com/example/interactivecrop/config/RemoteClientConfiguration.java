package com.example.interactivecrop.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RemoteClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RemoteClientConfiguration.class);

    @Bean
    public RestTemplate remoteRestTemplate(RestTemplateBuilder builder, CropProperties properties) {
        CropProperties.Remote remote = properties.remote();
        log.info("Crop decisions and previews use remote endpoint {}", remote.baseUrl());
        return builder
                .rootUri(remote.baseUrl())
                .setConnectTimeout(remote.connectTimeout())
                .setReadTimeout(remote.readTimeout())
                .build();
    }
}
