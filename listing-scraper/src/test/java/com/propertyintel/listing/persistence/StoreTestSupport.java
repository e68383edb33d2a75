package com.propertyintel.listing.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Boots the application against in-memory H2 and empties the listing tables before each test.
 * The system user row is kept; the persistence service caches its id.
 */
@SpringBootTest
public abstract class StoreTestSupport {

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanStore() {
        jdbcTemplate.update("DELETE FROM property_prices");
        jdbcTemplate.update("DELETE FROM property_amenities");
        jdbcTemplate.update("DELETE FROM property_images");
        jdbcTemplate.update("DELETE FROM property_parameters");
        jdbcTemplate.update("DELETE FROM parameters");
        jdbcTemplate.update("DELETE FROM properties");
        jdbcTemplate.update("DELETE FROM scrape_runs");
    }

    protected int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }
}
