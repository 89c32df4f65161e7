package com.flagship.iam_service.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Jackson configuration.
 *
 * The transcoder writes and parses through this mapper's tree model. The
 * event mapper uses it to read record components and to rebuild event
 * records from decoded fields with convertValue().
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Instant timestamps on event records
        mapper.registerModule(new JavaTimeModule());

        // Stored state may hold fields the event type no longer declares
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }
}
