package com.propertyintel.listing.pipeline;

import com.propertyintel.listing.config.ListingScraperProperties;
import com.propertyintel.listing.model.RunReport;
import com.propertyintel.listing.persistence.PropertyRepository;
import com.propertyintel.listing.persistence.ScrapeRunRepository;
import com.propertyintel.listing.persistence.StoreTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class IngestionPipelineTest extends StoreTestSupport {

    private static final String LIST_URL = "http://localhost/v1/statements";

    private static final String PAGE_1 = """
            {"result": true, "data": {"data": [
              %s,
              %s
            ], "meta": {"current_page": 1, "last_page": 2}}}
            """.formatted(
            listing("P1", "Vaja-Pshavela 1", 41.7100, 80, 1000),
            listing("P2", "Chavchavadze Ave 10", 41.7200, 120, 2500));

    private static final String PAGE_2 = """
            {"result": true, "data": {"data": [
              %s,
              {"id": "P4", "dynamic_title": "ბინა", "lat": 0.0, "lng": 44.8,
               "real_estate_type_id": 1, "deal_type_id": 1, "area": "50",
               "price": {"1": {"price_total": 900}}}
            ], "meta": {"current_page": 2, "last_page": 2}}}
            """.formatted(
            listing("P3", "Kazbegi Ave 30", 41.7300, 60, 700));

    @Autowired
    private IngestionPipeline pipeline;
    @Autowired
    private RestTemplate restTemplate;
    @Autowired
    private PropertyRepository propertyRepository;
    @Autowired
    private ScrapeRunRepository scrapeRunRepository;
    @Autowired
    private ListingScraperProperties properties;

    private MockRestServiceServer server;

    @BeforeEach
    void bindServer() {
        server = MockRestServiceServer.bindTo(restTemplate).ignoreExpectOrder(true).build();
    }

    @AfterEach
    void disableImageDownload() {
        properties.getFeatures().setImageDownload(false);
    }

    @Test
    void run_InsertsValidListingsAndReports() {
        // Arrange
        expectPage("1", PAGE_1);
        expectPage("2", PAGE_2);

        // Act
        RunReport report = pipeline.run().orElseThrow();

        // Assert
        server.verify();
        assertEquals(RunReport.Status.SUCCESS, report.getStatus());
        assertEquals(4, report.getTotalFetched());
        assertEquals(3, report.getValid());
        assertEquals(1, report.getInvalid());
        assertEquals(3, report.getInserted());
        assertEquals(1, report.getExcludedByReason().get("OUT_OF_BOUNDS"));
        assertEquals(3, report.getConversionFallbacks(), "Live rates are off, so every USD price comes from the table");
        assertEquals(3, propertyRepository.count());
        assertEquals(Optional.of("SUCCESS"), scrapeRunRepository.findStatus(report.getRunId()));
        assertFalse(pipeline.isRunning());
    }

    @Test
    void run_IsIdempotentOnSecondPass() {
        // Arrange
        expectPage("1", PAGE_1);
        expectPage("2", PAGE_2);
        pipeline.run();
        server = MockRestServiceServer.bindTo(restTemplate).ignoreExpectOrder(true).build();
        expectPage("1", PAGE_1);
        expectPage("2", PAGE_2);

        // Act
        RunReport second = pipeline.run().orElseThrow();

        // Assert
        assertEquals(0, second.getInserted());
        assertEquals(3, second.getUpdated());
        assertEquals(3, propertyRepository.count());
        assertEquals(3, countRows("property_prices"), "Unchanged prices add no history");
    }

    @Test
    void run_SkipsFailedPageAndCarriesOn() {
        // Arrange
        server.expect(ExpectedCount.times(3), requestTo(startsWith(LIST_URL)))
                .andExpect(queryParam("page", "1"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        expectPage("2", PAGE_2);

        // Act
        RunReport report = pipeline.run().orElseThrow();

        // Assert
        server.verify();
        assertEquals(RunReport.Status.SUCCESS, report.getStatus());
        assertEquals(1, report.getPagesFailed());
        assertEquals(2, report.getRetries());
        assertEquals(1, report.getInserted());
    }

    @Test
    void run_MirrorsImagesOnlyForWrittenListings() {
        // Arrange
        properties.getFeatures().setImageDownload(true);
        String id = "M" + System.nanoTime();
        String first = listing(id, "Vaja-Pshavela 1", 41.7100, 80, 1000);
        String repeat = first.replace("/1.jpg", "/repeat.jpg");
        expectPage("1", """
                {"result": true, "data": {"data": [%s, %s], "meta": {"current_page": 1, "last_page": 1}}}
                """.formatted(first, repeat));
        server.expect(ExpectedCount.once(), requestTo("https://static.my.ge/" + id + "/1.jpg"))
                .andRespond(withSuccess(new byte[]{1, 2, 3}, MediaType.IMAGE_JPEG));

        // Act
        RunReport report = pipeline.run().orElseThrow();

        // Assert
        server.verify();
        assertEquals(RunReport.Status.SUCCESS, report.getStatus(), "The skipped repeat must not fetch its image");
        assertEquals(1, report.getInserted());
        assertEquals(1, report.getDuplicatesSkipped());
        String localPath = jdbcTemplate.queryForObject("""
                SELECT i.local_path FROM property_images i JOIN properties p ON p.id = i.property_id
                WHERE p.external_id = ?
                """, String.class, id);
        assertNotNull(localPath, "Mirrored copy is recorded after the batch commits");
        assertTrue(localPath.endsWith(".jpg"));
    }

    @Test
    void cancel_ReturnsFalseWhenIdle() {
        assertFalse(pipeline.cancel());
        assertTrue(pipeline.currentReport().isEmpty());
    }

    private void expectPage(String page, String body) {
        server.expect(requestTo(startsWith(LIST_URL)))
                .andExpect(queryParam("page", page))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    private static String listing(String id, String address, double lat, int area, int priceGel) {
        return """
                {"id": "%s", "dynamic_title": "იყიდება ბინა", "comment": "ახალი რემონტი",
                 "lat": %s, "lng": 44.80, "real_estate_type_id": 1, "deal_type_id": 1,
                 "area": "%d", "room": "3", "floor": "2", "total_floors": "9",
                 "address": "%s", "city_name": "Tbilisi", "district_name": "Vake",
                 "price": {"1": {"price_total": %d}},
                 "images": [{"large": "https://static.my.ge/%s/1.jpg", "is_main": true}]}
                """.formatted(id, lat, area, address, priceGel, id);
    }
}
