package com.propertyintel.listing.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the listing schema when it is missing. Plain SQL that both PostgreSQL and H2 accept.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring listing schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS users
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                email           VARCHAR(255) NOT NULL UNIQUE,
                full_name       VARCHAR(255),
                role            VARCHAR(32)  NOT NULL,
                created_at      TIMESTAMP    NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS properties
            (
                id                      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                external_id             VARCHAR(64)   NOT NULL,
                source                  VARCHAR(64)   NOT NULL,
                owner_id                BIGINT REFERENCES users (id),
                title_ka                TEXT,
                title_en                TEXT,
                title_ru                TEXT,
                description_ka          TEXT,
                description_en          TEXT,
                description_ru          TEXT,
                price                   NUMERIC(14, 2),
                currency                VARCHAR(3),
                price_usd               NUMERIC(14, 2),
                property_type           VARCHAR(32),
                deal_type               VARCHAR(32),
                owner_type              VARCHAR(16),
                area                    NUMERIC(10, 2),
                rooms                   INTEGER,
                bedrooms                INTEGER,
                bathrooms               INTEGER,
                floor_number            INTEGER,
                total_floors            INTEGER,
                address                 VARCHAR(500),
                city                    VARCHAR(128),
                district                VARCHAR(128),
                urban_area              VARCHAR(128),
                latitude                DOUBLE PRECISION,
                longitude               DOUBLE PRECISION,
                version                 BIGINT DEFAULT 0 NOT NULL,
                translated_at           TIMESTAMP,
                enrichment_lease_until  TIMESTAMP,
                created_at              TIMESTAMP     NOT NULL,
                updated_at              TIMESTAMP     NOT NULL,
                last_scraped            TIMESTAMP     NOT NULL,
                CONSTRAINT uq_properties_external UNIQUE (external_id, source)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_properties_area ON properties (city, district)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_properties_geo ON properties (latitude, longitude)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_properties_translated ON properties (translated_at)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS parameters
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                external_id     INTEGER      NOT NULL UNIQUE,
                param_key       VARCHAR(128) NOT NULL,
                created_at      TIMESTAMP    NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS property_parameters
            (
                property_id     BIGINT NOT NULL REFERENCES properties (id) ON DELETE CASCADE,
                parameter_id    BIGINT NOT NULL REFERENCES parameters (id) ON DELETE CASCADE,
                param_value     VARCHAR(500),
                PRIMARY KEY (property_id, parameter_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS property_images
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                property_id     BIGINT        NOT NULL REFERENCES properties (id) ON DELETE CASCADE,
                image_url       VARCHAR(1000) NOT NULL,
                local_path      VARCHAR(1000),
                sort_order      INTEGER       NOT NULL,
                is_primary      BOOLEAN DEFAULT FALSE NOT NULL,
                CONSTRAINT uq_property_images_order UNIQUE (property_id, sort_order)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS property_amenities
            (
                property_id     BIGINT       NOT NULL REFERENCES properties (id) ON DELETE CASCADE,
                amenity_key     VARCHAR(128) NOT NULL,
                PRIMARY KEY (property_id, amenity_key)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS property_prices
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                property_id     BIGINT         NOT NULL REFERENCES properties (id) ON DELETE CASCADE,
                price           NUMERIC(14, 2) NOT NULL,
                currency        VARCHAR(3)     NOT NULL,
                price_usd       NUMERIC(14, 2),
                recorded_at     TIMESTAMP      NOT NULL
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_property_prices_property ON property_prices (property_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scrape_runs
            (
                run_id                  VARCHAR(64)  PRIMARY KEY,
                source                  VARCHAR(64)  NOT NULL,
                status                  VARCHAR(16)  NOT NULL,
                started_at              TIMESTAMP    NOT NULL,
                completed_at            TIMESTAMP,
                elapsed_millis          BIGINT,
                total_fetched           INTEGER,
                valid_records           INTEGER,
                invalid_records         INTEGER,
                inserted                INTEGER,
                updated                 INTEGER,
                duplicates_skipped      INTEGER,
                owner_prioritized       INTEGER,
                errors                  INTEGER,
                conversion_fallbacks    INTEGER,
                pages_fetched           INTEGER,
                pages_failed            INTEGER,
                retries                 INTEGER,
                error_message           VARCHAR(2000)
            )
        """);

        log.info("Listing schema ready.");
    }
}
