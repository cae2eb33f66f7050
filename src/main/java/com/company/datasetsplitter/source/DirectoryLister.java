package com.company.datasetsplitter.source;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the regular files under a directory whose extension matches, sorted by path.
 */
@Slf4j
@Component
public class DirectoryLister {

    public List<Path> listFiles(Path root, String extension, boolean recursive) {
        String suffix = "." + extension.toLowerCase(Locale.ROOT);
        try (Stream<Path> paths = recursive ? Files.walk(root) : Files.list(root)) {
            List<Path> files = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
                    .sorted()
                    .collect(Collectors.toList());
            log.debug("Found {} *{} files under {}", files.size(), suffix, root);
            return files;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files under " + root, e);
        }
    }
}
