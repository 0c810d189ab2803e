package com.al.clinicalconverter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared, thread-safe helpers for the parsers and the conversion processor.
 */
@Configuration
public class ParserConfig {

    /**
     * Mapper used to serialize parsed trees and conversion payloads. Reused
     * because ObjectMapper is thread-safe once configured.
     */
    @Bean
    public ObjectMapper conversionObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }
}
