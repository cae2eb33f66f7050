package com.company.datasetsplitter.strategy;

import lombok.extern.slf4j.Slf4j;

/**
 * Factory for creating partition layouts
 * Following Factory Pattern and Open/Closed Principle
 */
@Slf4j
public final class PartitionLayoutFactory {

    private PartitionLayoutFactory() {
    }

    public static PartitionLayout createLayout(boolean makeDirectory) {
        PartitionLayout layout = makeDirectory ? new SubdirectoryPartitionLayout() : new FlatPartitionLayout();
        log.debug("Using partition layout: {}", layout.getLayoutName());
        return layout;
    }
}
