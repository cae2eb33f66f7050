package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.exception.PartitionPathCollisionException;
import com.company.datasetsplitter.strategy.PartitionLayout;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps each category to its target file and rejects plans where two categories would share a file.
 * Paths are compared case-insensitively so the outcome does not depend on the filesystem.
 */
@Component
public class PartitionPathResolver {

    /**
     * @return target path per category, in category order
     * @throws PartitionPathCollisionException for an unsafe category or two categories sharing a target
     */
    public Map<String, Path> resolveTargets(String fileName, List<String> categories, PartitionLayout layout,
                                            Path outputDir, String baseName, String extension) {
        Map<String, Path> targets = new LinkedHashMap<>();
        Map<String, String> claimed = new HashMap<>();
        for (String category : categories) {
            if (!isSafeSegment(category)) {
                throw PartitionPathCollisionException.unsafeCategory(fileName, category);
            }
            Path target = layout.targetPath(outputDir, baseName, category, extension);
            String key = target.toAbsolutePath().normalize().toString().toLowerCase(Locale.ROOT);
            String previous = claimed.putIfAbsent(key, category);
            if (previous != null) {
                throw PartitionPathCollisionException.collision(fileName, category, previous, target.toString());
            }
            targets.put(category, target);
        }
        return targets;
    }

    static boolean isSafeSegment(String category) {
        return !category.isEmpty()
                && !category.equals(".")
                && !category.equals("..")
                && category.indexOf('/') < 0
                && category.indexOf('\\') < 0
                && category.indexOf('\0') < 0;
    }
}
