package com.company.datasetsplitter.writer;

import com.company.datasetsplitter.table.Table;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Writes into a hidden sibling temp file and moves it over the target once complete.
 * A failed write leaves the target untouched and removes the temp file.
 */
@Slf4j
public abstract class AbstractTableWriter implements TableWriter {

    @Override
    public final void write(Table table, Path target) throws IOException {
        Path temp = target.resolveSibling(
                "." + target.getFileName() + "." + UUID.randomUUID().toString().substring(0, 8) + ".tmp");
        try {
            writeFile(table, temp);
            moveIntoPlace(temp, target);
            log.debug("Wrote {} rows to {}", table.getRowCount(), target);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * Serialize {@code table} to {@code file}, which does not exist yet.
     */
    protected abstract void writeFile(Table table, Path file) throws IOException;

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
