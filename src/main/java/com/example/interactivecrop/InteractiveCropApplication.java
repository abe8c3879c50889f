package com.example.interactivecrop;

import com.example.interactivecrop.config.CropProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CropProperties.class)
public class InteractiveCropApplication {

    public static void main(String[] args) {
        SpringApplication.run(InteractiveCropApplication.class, args);
    }
}
