package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.exception.SplitterException;
import com.company.datasetsplitter.logging.LoggingContext;
import com.company.datasetsplitter.model.ScanMode;
import com.company.datasetsplitter.table.TabularQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Forces evaluation of the category column and returns its distinct values.
 *
 * <p>This is the one point before fan-out where rows are actually read. The evaluation runs on the
 * file's worker pool and the caller blocks until it completes. Nulls never become a category.
 */
@Slf4j
@Component
public class CategoryResolver {

    public ResolvedCategories resolve(TabularQuery query, String column, ScanMode scanMode,
                                      ExecutorService pool) {
        CategoryInterner interner = new CategoryInterner();
        TabularQuery partitionSource = scanMode == ScanMode.CACHED
                ? query.mapValues(column, interner::intern).cache()
                : query;

        Future<List<String>> discovery = pool.submit(LoggingContext.propagate(() -> {
            Set<String> distinct = new LinkedHashSet<>();
            partitionSource.select(column).scan(row -> {
                if (row[0] != null) {
                    distinct.add(interner.intern(row[0]));
                }
            });
            return new ArrayList<>(distinct);
        }));

        List<String> categories = await(discovery, query.getSourceName());
        log.debug("Resolved {} categories in {} ({} scan)", categories.size(), query.getSourceName(), scanMode);
        return new ResolvedCategories(List.copyOf(categories), partitionSource, interner);
    }

    private static <T> T await(Future<T> future, String sourceName) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SplitterException("Interrupted while resolving categories of " + sourceName,
                    sourceName, null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SplitterException("Failed to resolve categories of " + sourceName, sourceName, null, cause);
        }
    }
}
