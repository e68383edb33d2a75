package com.propertyintel.listing.report;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.config.ListingScraperProperties.Report.ReportFormat;
import com.propertyintel.listing.model.RunReport;
import com.propertyintel.listing.persistence.ScrapeRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

class ReportRouterTest {

    @Mock
    private ScrapeRunRepository scrapeRunRepository;
    @Mock
    private NdjsonReportWriter ndjsonWriter;
    @Mock
    private CsvReportWriter csvWriter;

    private ListingScraperProperties properties;
    private ReportRouter router;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new ListingScraperProperties();
        router = new ReportRouter(scrapeRunRepository, ndjsonWriter, csvWriter, properties);
    }

    @Test
    void publish_WritesEveryConfiguredFormat() {
        properties.getReport().setFormats(EnumSet.of(ReportFormat.NDJSON, ReportFormat.CSV));
        RunReport report = ReportWritersTest.report("run-1");

        router.publish(report);

        verify(scrapeRunRepository).save(report);
        verify(ndjsonWriter).write(report);
        verify(csvWriter).write(report);
    }

    @Test
    void publish_SkipsUnconfiguredFormat() {
        properties.getReport().setFormats(EnumSet.of(ReportFormat.NDJSON));

        router.publish(ReportWritersTest.report("run-2"));

        verifyNoInteractions(csvWriter);
    }

    @Test
    void publish_ContinuesWhenOneSinkFails() {
        // Arrange
        properties.getReport().setFormats(EnumSet.of(ReportFormat.NDJSON, ReportFormat.CSV));
        RunReport report = ReportWritersTest.report("run-3");
        when(ndjsonWriter.write(report)).thenThrow(new UncheckedIOException(new IOException("disk full")));

        // Act & Assert
        assertDoesNotThrow(() -> router.publish(report));
        verify(csvWriter).write(report);
    }
}
