package com.company.datasetsplitter.e2e;

import com.company.datasetsplitter.DatasetSplitterApplication;
import com.company.datasetsplitter.cli.SplitterRunner;
import com.company.datasetsplitter.model.SplitRunSummary;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Starts the application the way the command line does and checks the files it leaves behind
 */
class SplitterEndToEndTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("in"));
        outputDir = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(inputDir.resolve("q1.csv"), "region,val\nEU,1\nUS,2\n,3\n");
        Files.writeString(inputDir.resolve("q2.csv"), "region,val\nUS,4\nAPAC,5\n");
        Files.writeString(inputDir.resolve("other.csv"), "country,val\nFR,6\n");
    }

    @Test
    void directoryBatch_shouldSplitEveryFileAndSkipFilesWithoutTheColumn() throws IOException {
        // When
        int exitCode = run("--splitter.output-format=csv", "--splitter.fill-null-value=OTHER");

        // Then
        assertThat(exitCode).isEqualTo(SplitRunSummary.EXIT_OK);
        assertThat(outputFiles()).containsExactly(
                "q1_EU.csv", "q1_OTHER.csv", "q1_US.csv", "q2_APAC.csv", "q2_US.csv");
        assertThat(Files.readAllLines(outputDir.resolve("q2_US.csv"))).containsExactly("val", "4");
    }

    @Test
    void subdirectoryLayout_shouldWriteSpreadsheetsPerCategory() throws IOException {
        // When
        int exitCode = run("--splitter.output-format=xlsx", "--splitter.make-dir=true",
                "--splitter.keep-category-col=true");

        // Then
        assertThat(exitCode).isEqualTo(SplitRunSummary.EXIT_OK);
        Path us = outputDir.resolve("US").resolve("q1.xlsx");
        assertThat(us).exists();
        assertThat(outputDir.resolve("APAC").resolve("q2.xlsx")).exists();
        try (InputStream in = Files.newInputStream(us); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheet("Sheet1");
            assertThat(sheet.getRow(0).getCell(0).getStringCellValue()).isEqualTo("region");
            assertThat(sheet.getRow(1).getCell(1).getStringCellValue()).isEqualTo("2");
        }
    }

    @Test
    void unsupportedOutputFormat_shouldAbortBeforeWritingAnything() throws IOException {
        // When
        int exitCode = run("--splitter.output-format=json");

        // Then
        assertThat(exitCode).isEqualTo(SplitRunSummary.EXIT_ABORTED);
        assertThat(outputFiles()).isEmpty();
    }

    @Test
    void failedFile_shouldYieldFailureExitCodeAfterProcessingTheRest() throws IOException {
        // Given two categories of q3 collide on a case-insensitive comparison
        Files.writeString(inputDir.resolve("q3.csv"), "region,val\nEU,7\neu,8\n");

        // When
        int exitCode = run("--splitter.output-format=csv");

        // Then
        assertThat(exitCode).isEqualTo(SplitRunSummary.EXIT_FILE_FAILURES);
        assertThat(outputFiles()).contains("q1_EU.csv", "q2_APAC.csv").noneMatch(name -> name.startsWith("q3"));
    }

    private int run(String... extraArgs) {
        List<String> args = new ArrayList<>(List.of(
                "--splitter.category-col=region",
                "--splitter.input-path=" + inputDir,
                "--splitter.output-dir=" + outputDir,
                "--splitter.extension=csv",
                "--splitter.worker-threads=2"));
        args.addAll(Arrays.asList(extraArgs));

        ConfigurableApplicationContext context = new SpringApplicationBuilder(DatasetSplitterApplication.class)
                .run(args.toArray(new String[0]));
        assertThat(context.getBean(SplitterRunner.class).getLastSummary()).isNotNull();
        return SpringApplication.exit(context);
    }

    private List<String> outputFiles() throws IOException {
        try (Stream<Path> files = Files.walk(outputDir)) {
            return files.filter(Files::isRegularFile)
                    .map(path -> outputDir.relativize(path).toString())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
