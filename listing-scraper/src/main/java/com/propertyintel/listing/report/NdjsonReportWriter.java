package com.propertyintel.listing.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.model.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends each run report as one JSON line to {outputDir}/scrape_runs.ndjson.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NdjsonReportWriter {

    static final String FILE_NAME = "scrape_runs.ndjson";

    private final ListingScraperProperties properties;
    private final ObjectMapper objectMapper;

    public synchronized Path write(RunReport report) {
        Path outputDir = properties.getReport().getOutputDir();
        Path outputPath = outputDir.resolve(FILE_NAME);
        try {
            Files.createDirectories(outputDir);
            String line = objectMapper.writeValueAsString(report) + "\n";
            Files.writeString(outputPath, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.info("Appended run report {} to {}", report.getRunId(), outputPath);
            return outputPath;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Run report " + report.getRunId() + " is not serializable", e);
        } catch (IOException e) {
            log.error("Failed to append run report to {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("NDJSON report write failed", e);
        }
    }
}
