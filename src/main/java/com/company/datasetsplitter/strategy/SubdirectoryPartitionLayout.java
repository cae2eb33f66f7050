package com.company.datasetsplitter.strategy;

import java.nio.file.Path;

/**
 * {@code output_dir/<category>/<basename>.<ext>}
 */
public class SubdirectoryPartitionLayout implements PartitionLayout {

    @Override
    public Path targetPath(Path outputDir, String baseName, String category, String extension) {
        return outputDir.resolve(category).resolve(baseName + "." + extension);
    }

    @Override
    public Path parentDirectory(Path outputDir, String category) {
        return outputDir.resolve(category);
    }

    @Override
    public String getLayoutName() {
        return "SUBDIRECTORY";
    }
}
