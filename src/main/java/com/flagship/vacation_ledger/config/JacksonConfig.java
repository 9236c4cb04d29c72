package com.flagship.vacation_ledger.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for API bodies and cached analytics payloads.
 *
 * - java.time support (LocalDate, Instant, YearMonth)
 * - ISO-8601 strings instead of numeric timestamps
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer vacationObjectMapperCustomizer() {
        return builder -> builder
            .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .postConfigurer(mapper -> mapper.registerModule(new JavaTimeModule()));
    }
}
