package com.flagship.handle_pay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.math.BigInteger;

/**
 * Jackson configuration for API responses and event payloads.
 *
 * - ISO-8601 dates instead of timestamps
 * - BigInteger amounts written as JSON strings: base-unit amounts routinely
 *   exceed what JavaScript numbers represent exactly
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        SimpleModule amounts = new SimpleModule("amounts");
        amounts.addSerializer(BigInteger.class, ToStringSerializer.instance);
        mapper.registerModule(amounts);

        return mapper;
    }
}
