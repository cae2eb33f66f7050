package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.exception.PartitionWriteException;
import com.company.datasetsplitter.exception.SplitterException;
import com.company.datasetsplitter.logging.LoggingContext;
import com.company.datasetsplitter.metrics.SplitterMetrics;
import com.company.datasetsplitter.model.PartitionResult;
import com.company.datasetsplitter.model.SplitRequest;
import com.company.datasetsplitter.strategy.PartitionLayout;
import com.company.datasetsplitter.strategy.PartitionLayoutFactory;
import com.company.datasetsplitter.table.TabularQuery;
import com.company.datasetsplitter.writer.TableWriter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Fans one file out into one partition file per category on the file's worker pool.
 *
 * <p>Every task is dispatched and every task is waited for. A failing task never stops its siblings;
 * once all have finished, the first failure observed is thrown with any later ones attached as suppressed.
 */
@Slf4j
@Component
public class PartitionWriter {

    private final PartitionPathResolver pathResolver;
    private final SplitterMetrics metrics;

    public PartitionWriter(PartitionPathResolver pathResolver, SplitterMetrics metrics) {
        this.pathResolver = pathResolver;
        this.metrics = metrics;
    }

    /**
     * @return one result per category, in category discovery order
     * @throws PartitionWriteException when any partition failed, after all partitions have finished
     */
    public List<PartitionResult> writePartitions(String fileName, ResolvedCategories resolved,
                                                 SplitRequest request, TableWriter writer, ExecutorService pool) {
        String column = request.getCategoryColumn();
        PartitionLayout layout = PartitionLayoutFactory.createLayout(request.isMakeDirectory());
        Map<String, Path> targets = pathResolver.resolveTargets(fileName, resolved.getCategories(), layout,
                request.getOutputDir(), baseName(fileName), request.getOutputFormat().getExtension());

        if (request.isMakeDirectory()) {
            createDirectories(fileName, resolved.getCategories(), layout, request.getOutputDir());
        }

        boolean dropColumn = dropsCategoryColumn(fileName, column, resolved.getPartitionSource(), request);
        List<PartitionTask> tasks = new ArrayList<>(targets.size());
        for (Map.Entry<String, Path> entry : targets.entrySet()) {
            String category = resolved.getInterner().intern(entry.getKey());
            TabularQuery view = resolved.getPartitionSource().filterEquals(column, category);
            if (dropColumn) {
                view = view.exclude(column);
            }
            tasks.add(new PartitionTask(fileName, category, view, entry.getValue(), writer, metrics));
        }
        return runAll(fileName, tasks, pool);
    }

    /**
     * The category column is dropped unless asked to keep it, or unless it is the only column, in which case
     * dropping it would leave partitions without any column to write.
     */
    private static boolean dropsCategoryColumn(String fileName, String column, TabularQuery source,
                                               SplitRequest request) {
        if (request.isKeepCategoryColumn()) {
            return false;
        }
        if (source.columns().size() == 1) {
            log.warn("{} has no column besides {}, keeping it in the partitions", fileName, column);
            return false;
        }
        return true;
    }

    private List<PartitionResult> runAll(String fileName, List<PartitionTask> tasks, ExecutorService pool) {
        CompletionService<PartitionResult> completion = new ExecutorCompletionService<>(pool);
        for (PartitionTask task : tasks) {
            completion.submit(LoggingContext.propagate(task));
        }

        int total = tasks.size();
        List<PartitionResult> results = new ArrayList<>(total);
        PartitionWriteException firstFailure = null;
        for (int done = 1; done <= total; done++) {
            Future<PartitionResult> future = take(completion, fileName);
            try {
                PartitionResult result = future.get();
                results.add(result);
                log.info("Partition {}/{} of {} written: {} ({} rows)",
                        done, total, fileName, result.getCategory(), result.getRowCount());
            } catch (ExecutionException e) {
                PartitionWriteException failure = asWriteException(fileName, e.getCause());
                log.error("Partition {}/{} of {} failed: {}", done, total, fileName, failure.getMessage());
                if (firstFailure == null) {
                    firstFailure = failure;
                } else {
                    firstFailure.addSuppressed(failure);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SplitterException("Interrupted while writing partitions of " + fileName, fileName, null, e);
            }
        }

        if (firstFailure != null) {
            throw firstFailure;
        }
        List<String> order = tasks.stream().map(PartitionTask::getCategory).toList();
        results.sort(Comparator.comparingInt(result -> order.indexOf(result.getCategory())));
        return results;
    }

    private static Future<PartitionResult> take(CompletionService<PartitionResult> completion, String fileName) {
        try {
            return completion.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SplitterException("Interrupted while writing partitions of " + fileName, fileName, null, e);
        }
    }

    private static PartitionWriteException asWriteException(String fileName, Throwable cause) {
        if (cause instanceof PartitionWriteException) {
            return (PartitionWriteException) cause;
        }
        return new PartitionWriteException("Partition task for " + fileName + " failed: " + cause.getMessage(),
                fileName, null, null, cause);
    }

    private static void createDirectories(String fileName, List<String> categories, PartitionLayout layout,
                                          Path outputDir) {
        for (String category : categories) {
            Path directory = layout.parentDirectory(outputDir, category);
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new PartitionWriteException("Cannot create directory " + directory + " for category '"
                        + category + "' of " + fileName, fileName, category, directory.toString(), e);
            }
        }
    }

    /**
     * Input file name without its last extension.
     */
    static String baseName(String fileName) {
        return StringUtils.substringBeforeLast(fileName, ".");
    }
}
