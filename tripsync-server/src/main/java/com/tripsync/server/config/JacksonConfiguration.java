package com.tripsync.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.server.json.TripJson;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class JacksonConfiguration {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return TripJson.createObjectMapper();
    }
}
