package com.company.datasetsplitter.exception;

/**
 * Two categories of one file resolve to the same output path, or a category cannot be used
 * as a path segment. Raised before any partition task is dispatched.
 */
public class PartitionPathCollisionException extends PartitionWriteException {

    public PartitionPathCollisionException(String message, String fileName, String category, String targetPath) {
        super(message, fileName, category, targetPath);
    }

    public static PartitionPathCollisionException collision(String fileName, String category,
                                                            String otherCategory, String targetPath) {
        return new PartitionPathCollisionException(
                String.format("Categories '%s' and '%s' of %s resolve to the same output path %s",
                        otherCategory, category, fileName, targetPath),
                fileName, category, targetPath);
    }

    public static PartitionPathCollisionException unsafeCategory(String fileName, String category) {
        return new PartitionPathCollisionException(
                String.format("Category '%s' of %s is not a safe path segment", category, fileName),
                fileName, category, null);
    }
}
