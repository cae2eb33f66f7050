package com.company.datasetsplitter.logging;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Aspect for performance logging of the splitting pipeline
 * Following AOP pattern for cross-cutting concerns
 */
@Aspect
@Component
@Slf4j
public class PerformanceLoggingAspect {

    private static final Logger performanceLogger = LoggerFactory.getLogger("PERFORMANCE");

    @Around("execution(* com.company.datasetsplitter.service.DatasetSplitterService.splitFile(..))")
    public Object logFileSplitPerformance(ProceedingJoinPoint joinPoint) throws Throwable {
        return logMethodPerformance(joinPoint, "FILE_SPLIT");
    }

    @Around("execution(* com.company.datasetsplitter.partition.CategoryResolver.resolve(..))")
    public Object logCategoryResolutionPerformance(ProceedingJoinPoint joinPoint) throws Throwable {
        return logMethodPerformance(joinPoint, "CATEGORY_RESOLUTION");
    }

    @Around("execution(* com.company.datasetsplitter.partition.PartitionWriter.writePartitions(..))")
    public Object logPartitionFanOutPerformance(ProceedingJoinPoint joinPoint) throws Throwable {
        return logMethodPerformance(joinPoint, "PARTITION_FAN_OUT");
    }

    /**
     * Generic method performance logging
     */
    private Object logMethodPerformance(ProceedingJoinPoint joinPoint, String operationType) throws Throwable {
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = joinPoint.getSignature().getName();

        long startTime = System.currentTimeMillis();
        LoggingContext.setOperationContext(operationType, className);

        try {
            log.debug("Starting {} operation: {}.{}", operationType, className, methodName);

            Object result = joinPoint.proceed();

            long duration = System.currentTimeMillis() - startTime;
            LoggingContext.setPerformanceContext(duration);

            performanceLogger.info("Operation completed: {} - {}.{} took {}ms",
                    operationType, className, methodName, duration);

            if (duration > getWarningThreshold(operationType)) {
                log.warn("Slow operation detected: {} - {}.{} took {}ms (threshold: {}ms)",
                        operationType, className, methodName, duration, getWarningThreshold(operationType));
            }

            return result;

        } catch (Throwable throwable) {
            long duration = System.currentTimeMillis() - startTime;
            LoggingContext.setPerformanceContext(duration);
            LoggingContext.setErrorContext(throwable.getClass().getSimpleName());

            performanceLogger.error("Operation failed: {} - {}.{} failed after {}ms with error: {}",
                    operationType, className, methodName, duration, throwable.getMessage());

            throw throwable;
        } finally {
            LoggingContext.clearOperationContext();
            LoggingContext.clearErrorContext();
        }
    }

    private long getWarningThreshold(String operationType) {
        return switch (operationType) {
            case "FILE_SPLIT" -> 60000L;
            case "CATEGORY_RESOLUTION" -> 10000L;
            case "PARTITION_FAN_OUT" -> 30000L;
            default -> 1000L;
        };
    }
}
