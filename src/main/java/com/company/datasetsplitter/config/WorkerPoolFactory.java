package com.company.datasetsplitter.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Creates the bounded worker pool that serves one source file: the forced category evaluation and
 * every partition task of that file. The caller shuts the pool down once the file is done.
 */
@Slf4j
@Component
public class WorkerPoolFactory {

    private final SplitterProperties properties;

    public WorkerPoolFactory(SplitterProperties properties) {
        this.properties = properties;
    }

    public ExecutorService newPool() {
        int threads = properties.getEffectiveWorkerThreads();
        log.debug("Creating worker pool with {} threads", threads);
        return Executors.newFixedThreadPool(threads, new BasicThreadFactory.Builder()
                .namingPattern("partition-writer-%d")
                .daemon(true)
                .build());
    }
}
