package com.flagship.bookkeeping.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * ObjectMapper shared by the HTTP facade and the expense import pipeline.
 *
 * Amounts are {@code BigDecimal} end to end:
 * - import payloads are parsed as {@code JsonNode}; floats are read as decimals so
 *   {@code 18.50} reaches the balance check exactly instead of as a binary double
 * - amounts are written plain; a total of {@code 0.0000002} would otherwise be
 *   written as {@code 2E-7}
 *
 * Dates ({@code LocalDate}, {@code LocalDateTime}) are ISO-8601 strings, matching the
 * text stored in {@code gl_entry}.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

        return mapper;
    }
}
