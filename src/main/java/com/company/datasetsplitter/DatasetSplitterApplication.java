package com.company.datasetsplitter;

import com.company.datasetsplitter.model.SplitRunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class DatasetSplitterApplication {

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = SpringApplication.exit(SpringApplication.run(DatasetSplitterApplication.class, args));
        } catch (RuntimeException e) {
            // invalid configuration fails context start-up; Spring has already reported the cause
            log.error("Dataset splitter did not start: {}", e.getMessage());
            exitCode = SplitRunSummary.EXIT_ABORTED;
        }
        System.exit(exitCode);
    }
}
