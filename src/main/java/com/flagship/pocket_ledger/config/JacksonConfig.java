package com.flagship.pocket_ledger.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * JSON mapping for the REST surface and the system clock.
 *
 * Key features:
 * - Java 8 date/time support (Instant, YearMonth, LocalDate)
 * - ISO-8601 date format (not timestamps)
 * - amounts written as plain decimals, never in scientific notation
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

        return mapper;
    }

    /**
     * Fills in the timestamp of intents recorded without one.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
