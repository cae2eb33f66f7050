package com.company.datasetsplitter.logging;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Logging context management for run IDs and structured logging
 * Following Utility Class pattern with MDC management
 */
@UtilityClass
public class LoggingContext {

    // MDC Keys
    public static final String RUN_ID = "runId";
    public static final String FILE = "file";
    public static final String CATEGORY = "category";
    public static final String OPERATION = "operation";
    public static final String COMPONENT = "component";
    public static final String ROW_COUNT = "rowCount";
    public static final String ERROR_TYPE = "errorType";
    public static final String PROCESSING_TIME_MS = "processingTimeMs";

    /**
     * Generate and set a new run ID
     * @return The generated run ID
     */
    public static String generateRunId() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID, runId);
        return runId;
    }

    public static void setFileContext(String fileName) {
        if (StringUtils.isNotBlank(fileName)) {
            MDC.put(FILE, fileName);
        }
    }

    public static void setCategoryContext(String category) {
        if (category != null) {
            MDC.put(CATEGORY, category);
        }
    }

    /**
     * Set operation context
     */
    public static void setOperationContext(String operation, String component) {
        if (StringUtils.isNotBlank(operation)) {
            MDC.put(OPERATION, operation);
        }
        if (StringUtils.isNotBlank(component)) {
            MDC.put(COMPONENT, component);
        }
    }

    public static void setRowCount(long rowCount) {
        MDC.put(ROW_COUNT, String.valueOf(rowCount));
    }

    public static void setErrorContext(String errorType) {
        if (StringUtils.isNotBlank(errorType)) {
            MDC.put(ERROR_TYPE, errorType);
        }
    }

    public static void setPerformanceContext(long processingTimeMs) {
        MDC.put(PROCESSING_TIME_MS, String.valueOf(processingTimeMs));
    }

    public static void clearFileContext() {
        MDC.remove(FILE);
        MDC.remove(CATEGORY);
        MDC.remove(ROW_COUNT);
    }

    public static void clearOperationContext() {
        MDC.remove(OPERATION);
        MDC.remove(COMPONENT);
        MDC.remove(PROCESSING_TIME_MS);
    }

    public static void clearErrorContext() {
        MDC.remove(ERROR_TYPE);
    }

    public static void clearAll() {
        MDC.clear();
    }

    /**
     * Get a snapshot of current MDC context
     */
    public static Map<String, String> getContextSnapshot() {
        Map<String, String> contextMap = MDC.getCopyOfContextMap();
        return contextMap != null ? new HashMap<>(contextMap) : new HashMap<>();
    }

    /**
     * Wrap a task so it runs on a worker thread with the submitting thread's context.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = getContextSnapshot();
        return () -> {
            Map<String, String> originalContext = MDC.getCopyOfContextMap();
            MDC.setContextMap(captured);
            try {
                return task.call();
            } finally {
                MDC.clear();
                if (originalContext != null) {
                    MDC.setContextMap(originalContext);
                }
            }
        };
    }
}
