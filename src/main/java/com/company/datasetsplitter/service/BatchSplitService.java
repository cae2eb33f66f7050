package com.company.datasetsplitter.service;

import com.company.datasetsplitter.exception.SplitterConfigurationException;
import com.company.datasetsplitter.model.FileSplitResult;
import com.company.datasetsplitter.model.SplitRequest;
import com.company.datasetsplitter.model.SplitRunSummary;
import com.company.datasetsplitter.source.DirectoryLister;
import com.company.datasetsplitter.writer.TableWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a split over a single file or every matching file of a directory, one file at a time.
 */
@Slf4j
@Service
public class BatchSplitService {

    private final DatasetSplitterService splitterService;
    private final DirectoryLister directoryLister;

    public BatchSplitService(DatasetSplitterService splitterService, DirectoryLister directoryLister) {
        this.splitterService = splitterService;
        this.directoryLister = directoryLister;
    }

    /**
     * @throws SplitterConfigurationException when the input or output location is unusable
     */
    public SplitRunSummary run(SplitRequest request, TableWriter writer) {
        List<Path> files = resolveInputFiles(request);
        SplitRunSummary summary = new SplitRunSummary();

        int index = 0;
        for (Path file : files) {
            index++;
            log.info("Processing file {}/{}: {}", index, files.size(), file);
            FileSplitResult result = splitterService.splitFile(file, request, writer);
            summary.add(result);
            if (result.isFailed() && request.isFailFast()) {
                log.error("Stopping batch after failure of {} ({} files not processed)",
                        result.getFileName(), files.size() - index);
                break;
            }
        }
        return summary;
    }

    List<Path> resolveInputFiles(SplitRequest request) {
        Path outputDir = request.getOutputDir();
        if (!Files.isDirectory(outputDir)) {
            throw new SplitterConfigurationException(
                    "Output directory " + outputDir + " does not exist or is not a directory", "splitter.output-dir");
        }

        Path input = request.getInputPath();
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            throw new SplitterConfigurationException("Input path " + input + " does not exist", "splitter.input-path");
        }

        List<Path> files = directoryLister.listFiles(input, request.getExtension(), request.isRecursive());
        if (files.isEmpty()) {
            log.warn("No *.{} files found in {}", request.getExtension(), input);
        } else {
            log.info("Found {} *.{} files in {}", files.size(), request.getExtension(), input);
        }
        return files;
    }
}
