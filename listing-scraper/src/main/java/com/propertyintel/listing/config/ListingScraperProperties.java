package com.propertyintel.listing.config;

import com.propertyintel.listing.model.Currency;
import com.propertyintel.listing.model.DealType;
import com.propertyintel.listing.model.Language;
import com.propertyintel.listing.model.PropertyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Every tunable of the listing pipeline, bound from {@code listing-scraper.*}.
 *
 * Defaults mirror the production scraper configuration for myhome.ge. The whole tree is
 * validated when the context starts, so a bad value fails fast instead of at first use.
 */
@Component
@ConfigurationProperties(prefix = "listing-scraper")
@Validated
@Data
public class ListingScraperProperties {

    @NotBlank
    private String source = "myhome.ge";

    @Valid
    private Api api = new Api();
    @Valid
    private Fetch fetch = new Fetch();
    @Valid
    private Persistence persistence = new Persistence();
    @Valid
    private Features features = new Features();
    @Valid
    private Validation validation = new Validation();
    @Valid
    private Dedup dedup = new Dedup();
    @Valid
    private Mappings mappings = new Mappings();
    @Valid
    private Rates rates = new Rates();
    @Valid
    private Enrichment enrichment = new Enrichment();
    @Valid
    private Scheduling scheduling = new Scheduling();
    @Valid
    private Report report = new Report();
    @Valid
    private Media media = new Media();

    @Data
    public static class Api {
        @NotBlank
        private String listUrl = "https://api-statements.tnet.ge/v1/statements";
        @NotBlank
        private String detailUrl = "https://api-statements.tnet.ge/v1/statements";
        @NotBlank
        private String dealTypes = "1,2,3,7";
        @NotBlank
        private String realEstateTypes = "1,2,3,4,5,6";
        private String authorizationToken = "";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
        /** Static headers sent with every request, on top of the rotated identity. */
        private Map<String, String> headers = new LinkedHashMap<>(Map.of(
                "accept", "application/json, text/plain, */*",
                "origin", "https://www.myhome.ge",
                "referer", "https://www.myhome.ge/",
                "x-website-key", "myhome"
        ));
    }

    @Data
    public static class Fetch {
        @Min(1)
        private int maxRecordsPerRun = 1000;
        @Min(1)
        private int pageSize = 100;
        @Min(1)
        private int requestsPerMinute = 600;
        /** Fixed pause before each request, on top of the token bucket. */
        @NotNull
        private Duration delayBetweenRequests = Duration.ofMillis(100);
        /** Longest a caller waits for a rate-limiter permit before the request counts as failed. */
        @NotNull
        private Duration permitTimeout = Duration.ofMinutes(2);
        @Min(1)
        private int maxRetries = 3;
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);
        @Min(1)
        private int concurrency = 4;
        @Min(1)
        private int maxConsecutiveFailedPages = 3;
        @NotEmpty
        private List<String> userAgents = new ArrayList<>(List.of(
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/138.0.0.0 Safari/537.36",
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/138.0.0.0 Safari/537.36",
                "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/138.0.0.0 Safari/537.36",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.0 Safari/605.1.15"
        ));
    }

    @Data
    public static class Persistence {
        @Min(1)
        private int batchSize = 50;
        @NotNull
        private Duration batchTimeout = Duration.ofSeconds(60);
        @NotBlank
        private String systemUserEmail = "system@scraper.com";
    }

    @Data
    public static class Features {
        private boolean concurrentLanguages = true;
        private boolean imageDownload = false;
        private boolean deduplication = true;
        private boolean ownerPriority = true;
    }

    @Data
    public static class Validation {
        private double minLatitude = 40.0;
        private double maxLatitude = 43.6;
        private double minLongitude = 39.8;
        private double maxLongitude = 46.7;
        @NotEmpty
        private Map<Currency, PriceBand> priceRanges = new EnumMap<>(Map.of(
                Currency.USD, new PriceBand(new BigDecimal("50"), new BigDecimal("50000")),
                Currency.GEL, new PriceBand(new BigDecimal("135"), new BigDecimal("135000")),
                Currency.EUR, new PriceBand(new BigDecimal("45"), new BigDecimal("45000"))
        ));

        @AssertTrue(message = "bounding box minimums must be below maximums")
        public boolean isBoundingBoxOrdered() {
            return minLatitude < maxLatitude && minLongitude < maxLongitude;
        }
    }

    @Data
    public static class PriceBand {
        @NotNull
        private BigDecimal min;
        @NotNull
        private BigDecimal max;

        public PriceBand() {
        }

        public PriceBand(BigDecimal min, BigDecimal max) {
            this.min = min;
            this.max = max;
        }

        public boolean contains(BigDecimal amount) {
            return amount.compareTo(min) >= 0 && amount.compareTo(max) <= 0;
        }
    }

    @Data
    public static class Dedup {
        @DecimalMin("0.0")
        private double areaTolerance = 0.02;
        @DecimalMin("0.0")
        private double priceTolerance = 0.05;
        /** Degrees of latitude/longitude; 0.0001 is roughly ten metres. */
        @DecimalMin("0.0")
        private double coordinatePrecision = 0.0001;
        @NotEmpty
        private List<String> ownerIndicators = new ArrayList<>(List.of("owner", "individual", "private", "person"));
        @NotEmpty
        private List<String> agencyIndicators = new ArrayList<>(List.of("agency", "realtor", "broker", "company"));
    }

    @Data
    public static class Mappings {
        @NotEmpty
        private Map<Integer, PropertyType> propertyTypes = new LinkedHashMap<>(Map.of(
                1, PropertyType.APARTMENT,
                2, PropertyType.HOUSE,
                3, PropertyType.COMMERCIAL,
                4, PropertyType.COUNTRY_HOUSE,
                5, PropertyType.LAND_PLOT,
                6, PropertyType.HOTEL
        ));
        @NotEmpty
        private Map<Integer, DealType> dealTypes = new LinkedHashMap<>(Map.of(
                1, DealType.SALE,
                2, DealType.RENT,
                3, DealType.LEASE,
                7, DealType.DAILY_RENT
        ));
        /** The statements API keys prices by these codes. */
        @NotEmpty
        private Map<String, Currency> currencies = new LinkedHashMap<>(Map.of(
                "1", Currency.GEL,
                "2", Currency.USD,
                "3", Currency.EUR
        ));
        @NotNull
        private Currency primaryCurrency = Currency.GEL;
    }

    @Data
    public static class Rates {
        /** National Bank of Georgia daily rates feed. */
        private String liveUrl = "https://nbg.gov.ge/gw/api/ct/monetarypolicy/currencies/en/json";
        private boolean liveEnabled = true;
        @NotNull
        private Duration ttl = Duration.ofHours(6);
        @NotNull
        private Currency secondaryCurrency = Currency.USD;
        /** Keys are FROM_TO pairs: one unit of FROM buys this many units of TO. */
        @NotEmpty
        private Map<String, BigDecimal> fallback = new LinkedHashMap<>(Map.of(
                "USD_GEL", new BigDecimal("2.71"),
                "EUR_GEL", new BigDecimal("2.90"),
                "EUR_USD", new BigDecimal("1.07"),
                "USD_EUR", new BigDecimal("0.93")
        ));
    }

    @Data
    public static class Enrichment {
        private boolean enabled = true;
        @NotNull
        private Duration pollInterval = Duration.ofMinutes(5);
        @Min(1)
        private int batchSize = 10;
        @NotNull
        private Duration leaseDuration = Duration.ofMinutes(10);
        @NotEmpty
        private Set<Language> targetLanguages = EnumSet.of(Language.EN, Language.RU);
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 2 * * ?";
        private boolean runOnStartup = false;
        /** One thread for the ingestion cron and one for enrichment polling, at least. */
        @Min(2)
        private int poolSize = 2;
    }

    @Data
    public static class Report {
        @NotNull
        private Path outputDir = Path.of("/data/reports");
        @NotEmpty
        private Set<ReportFormat> formats = EnumSet.of(ReportFormat.NDJSON);

        public enum ReportFormat {
            NDJSON, CSV
        }
    }

    @Data
    public static class Media {
        @NotNull
        private Path storageDir = Path.of("/data/property_images");
        @Min(1)
        private int maxImagesPerListing = 20;
    }
}
