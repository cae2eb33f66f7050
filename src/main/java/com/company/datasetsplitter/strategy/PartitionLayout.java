package com.company.datasetsplitter.strategy;

import java.nio.file.Path;

/**
 * Strategy interface for placing partition files on disk
 * Following Strategy Pattern
 */
public interface PartitionLayout {

    /**
     * Target file for one category of one source file
     * @param outputDir root output directory
     * @param baseName source file stem
     * @param category category value, used verbatim
     * @param extension output extension without the dot
     */
    Path targetPath(Path outputDir, String baseName, String category, String extension);

    /**
     * Directory that must exist before {@link #targetPath} can be written.
     */
    default Path parentDirectory(Path outputDir, String category) {
        return outputDir;
    }

    String getLayoutName();
}
