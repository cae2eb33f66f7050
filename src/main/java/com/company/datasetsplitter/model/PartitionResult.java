package com.company.datasetsplitter.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * Outcome of one successfully written partition file.
 */
@Value
public class PartitionResult {
    String category;
    Path targetPath;
    long rowCount;
}
