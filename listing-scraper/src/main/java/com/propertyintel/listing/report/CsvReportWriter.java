package com.propertyintel.listing.report;

import com.opencsv.CSVWriter;
import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.model.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes one run report as a three-column CSV.
 *
 * Output path pattern: {outputDir}/run_{source}_{runId}.csv
 * e.g. /data/reports/run_myhome.ge_5f0c....csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvReportWriter {

    private static final String[] HEADERS = {"section", "metric", "value"};

    private final ListingScraperProperties properties;

    public Path write(RunReport report) {
        Path outputDir = properties.getReport().getOutputDir();
        ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(String.format("run_%s_%s.csv", report.getSource(), report.getRunId()));

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            writer.writeAll(toRows(report));
            log.info("Written run report to CSV: {}", outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV report {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV report write failed", e);
        }
    }

    List<String[]> toRows(RunReport r) {
        List<String[]> rows = new ArrayList<>();
        rows.add(row("run", "run_id", r.getRunId()));
        rows.add(row("run", "source", r.getSource()));
        rows.add(row("run", "status", r.getStatus()));
        rows.add(row("run", "started_at", r.getStartedAt()));
        rows.add(row("run", "completed_at", r.getCompletedAt()));
        rows.add(row("run", "elapsed_millis", r.getElapsedMillis()));
        rows.add(row("run", "error_message", r.getErrorMessage()));

        rows.add(row("fetch", "pages_fetched", r.getPagesFetched()));
        rows.add(row("fetch", "pages_failed", r.getPagesFailed()));
        rows.add(row("fetch", "retries", r.getRetries()));
        rows.add(row("fetch", "api_calls", r.getApiCalls()));

        rows.add(row("records", "total_fetched", r.getTotalFetched()));
        rows.add(row("records", "valid", r.getValid()));
        rows.add(row("records", "invalid", r.getInvalid()));
        rows.add(row("records", "inserted", r.getInserted()));
        rows.add(row("records", "updated", r.getUpdated()));
        rows.add(row("records", "duplicates_skipped", r.getDuplicatesSkipped()));
        rows.add(row("records", "owner_prioritized", r.getOwnerPrioritized()));
        rows.add(row("records", "persistence_conflicts", r.getPersistenceConflicts()));
        rows.add(row("records", "conversion_fallbacks", r.getConversionFallbacks()));
        rows.add(row("records", "errors", r.getErrors()));

        breakdown(rows, "excluded_by_reason", r.getExcludedByReason());
        breakdown(rows, "property_types", r.getPropertyTypes());
        breakdown(rows, "deal_types", r.getDealTypes());
        return rows;
    }

    private void breakdown(List<String[]> rows, String section, Map<String, Integer> counts) {
        if (counts != null) {
            counts.forEach((k, v) -> rows.add(row(section, k, v)));
        }
    }

    private String[] row(String section, String metric, Object value) {
        return new String[]{section, metric, value == null ? "" : value.toString()};
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create report directory: " + dir, e);
        }
    }
}
