package com.delta.digest.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DigestConfig {

    @Bean(name = "sourceExecutor", destroyMethod = "shutdown")
    public ExecutorService sourceExecutor(DigestProperties properties) {
        return Executors.newFixedThreadPool(properties.getSourceConcurrency());
    }

    @Bean(name = "extractionExecutor", destroyMethod = "shutdown")
    public ExecutorService extractionExecutor(DigestProperties properties) {
        return Executors.newFixedThreadPool(properties.getExtractionConcurrency());
    }

    @Bean(name = "downloadExecutor", destroyMethod = "shutdown")
    public ExecutorService downloadExecutor(DigestProperties properties) {
        return Executors.newFixedThreadPool(properties.getDownloadConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(DigestProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
