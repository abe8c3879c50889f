package com.example.interactivecrop.config;

import com.example.interactivecrop.interaction.DragLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InteractionConfiguration {

    @Bean
    public DragLock dragLock() {
        return new DragLock();
    }
}
