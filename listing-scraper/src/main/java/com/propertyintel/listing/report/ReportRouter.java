package com.propertyintel.listing.report;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.config.ListingScraperProperties.Report.ReportFormat;
import com.propertyintel.listing.model.RunReport;
import com.propertyintel.listing.persistence.ScrapeRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes a run report to the store and to every configured file format.
 * A failing sink is logged and never fails the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportRouter {

    private final ScrapeRunRepository scrapeRunRepository;
    private final NdjsonReportWriter ndjsonWriter;
    private final CsvReportWriter csvWriter;
    private final ListingScraperProperties properties;

    /** Record that a run has started. */
    public void started(RunReport report) {
        scrapeRunRepository.save(report);
    }

    public void publish(RunReport report) {
        scrapeRunRepository.save(report);

        for (ReportFormat format : properties.getReport().getFormats()) {
            try {
                switch (format) {
                    case NDJSON -> ndjsonWriter.write(report);
                    case CSV -> csvWriter.write(report);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to export run report {} as {}: {}", report.getRunId(), format, e.getMessage());
            }
        }
    }
}
