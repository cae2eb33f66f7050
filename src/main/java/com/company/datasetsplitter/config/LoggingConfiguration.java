package com.company.datasetsplitter.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import jakarta.annotation.PostConstruct;

/**
 * Logging configuration for structured logging and performance monitoring
 * Following configuration pattern with AOP enablement
 */
@Configuration
@EnableAspectJAutoProxy
@Slf4j
public class LoggingConfiguration {

    @PostConstruct
    public void initializeLogging() {
        log.debug("Performance monitoring enabled via AOP");
        log.debug("MDC Context Keys: runId, file, category, operation, component, rowCount");
        log.debug("Performance Thresholds: FILE_SPLIT(60s), CATEGORY_RESOLUTION(10s), PARTITION_FAN_OUT(30s)");
    }
}
