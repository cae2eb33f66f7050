package com.company.datasetsplitter.strategy;

import java.nio.file.Path;

/**
 * {@code output_dir/<basename>_<category>.<ext>}
 */
public class FlatPartitionLayout implements PartitionLayout {

    @Override
    public Path targetPath(Path outputDir, String baseName, String category, String extension) {
        return outputDir.resolve(baseName + "_" + category + "." + extension);
    }

    @Override
    public String getLayoutName() {
        return "FLAT";
    }
}
