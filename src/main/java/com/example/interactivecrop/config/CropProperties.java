package com.example.interactivecrop.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "crop")
public record CropProperties(
        @DefaultValue Layout layout,
        @DefaultValue Remote remote) {

    public record Layout(
            @DefaultValue("8") double padding,
            @DefaultValue("48") double textReserve,
            @DefaultValue("20") double minPreviewHeight,
            @DefaultValue("2000") double maxPreviewHeight) {
    }

    public record Remote(
            @DefaultValue("http://127.0.0.1:8188") String baseUrl,
            @DefaultValue("/view") String viewPath,
            @DefaultValue("/interactive_crop/submit") String submitPath,
            @DefaultValue("5s") Duration connectTimeout,
            @DefaultValue("30s") Duration readTimeout) {
    }
}
