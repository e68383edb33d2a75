package com.propertyintel.listing.persistence;

import com.propertyintel.listing.model.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores one row per ingestion run in {@code scrape_runs}. A run row is written when the run
 * starts and overwritten with the final counts when it ends.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ScrapeRunRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public void save(RunReport report) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("run_id", report.getRunId())
                .addValue("source", report.getSource())
                .addValue("status", report.getStatus().name())
                .addValue("started_at", report.getStartedAt())
                .addValue("completed_at", report.getCompletedAt())
                .addValue("elapsed_millis", report.getElapsedMillis())
                .addValue("total_fetched", report.getTotalFetched())
                .addValue("valid_records", report.getValid())
                .addValue("invalid_records", report.getInvalid())
                .addValue("inserted", report.getInserted())
                .addValue("updated", report.getUpdated())
                .addValue("duplicates_skipped", report.getDuplicatesSkipped())
                .addValue("owner_prioritized", report.getOwnerPrioritized())
                .addValue("errors", report.getErrors())
                .addValue("conversion_fallbacks", report.getConversionFallbacks())
                .addValue("pages_fetched", report.getPagesFetched())
                .addValue("pages_failed", report.getPagesFailed())
                .addValue("retries", report.getRetries())
                .addValue("error_message", truncate(report.getErrorMessage()));
        try {
            int updated = jdbc.update("""
                    UPDATE scrape_runs SET
                        status = :status, completed_at = :completed_at, elapsed_millis = :elapsed_millis,
                        total_fetched = :total_fetched, valid_records = :valid_records,
                        invalid_records = :invalid_records, inserted = :inserted, updated = :updated,
                        duplicates_skipped = :duplicates_skipped, owner_prioritized = :owner_prioritized,
                        errors = :errors, conversion_fallbacks = :conversion_fallbacks,
                        pages_fetched = :pages_fetched, pages_failed = :pages_failed, retries = :retries,
                        error_message = :error_message
                    WHERE run_id = :run_id
                    """, params);
            if (updated == 0) {
                jdbc.update("""
                        INSERT INTO scrape_runs
                        (run_id, source, status, started_at, completed_at, elapsed_millis, total_fetched,
                         valid_records, invalid_records, inserted, updated, duplicates_skipped,
                         owner_prioritized, errors, conversion_fallbacks, pages_fetched, pages_failed,
                         retries, error_message)
                        VALUES
                        (:run_id, :source, :status, :started_at, :completed_at, :elapsed_millis, :total_fetched,
                         :valid_records, :invalid_records, :inserted, :updated, :duplicates_skipped,
                         :owner_prioritized, :errors, :conversion_fallbacks, :pages_fetched, :pages_failed,
                         :retries, :error_message)
                        """, params);
            }
        } catch (DataAccessException e) {
            log.warn("Failed to write scrape run {}: {}", report.getRunId(), e.getMessage());
        }
    }

    public Optional<String> findStatus(String runId) {
        List<String> rows = jdbc.queryForList("SELECT status FROM scrape_runs WHERE run_id = :run_id",
                Map.of("run_id", runId), String.class);
        return rows.stream().findFirst();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }
}
