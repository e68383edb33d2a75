package com.propertyintel.listing.persistence;

import com.propertyintel.listing.model.Currency;
import com.propertyintel.listing.model.ListingImage;
import com.propertyintel.listing.model.ListingParameter;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Child rows of a property (images, parameters, amenities, price history) and the system user.
 */
@Repository
@RequiredArgsConstructor
public class ListingChildRepository {

    private final NamedParameterJdbcTemplate jdbc;

    /** Latest recorded price of a property. */
    public record PricePoint(BigDecimal price, Currency currency) {
    }

    // ── System user ──────────────────────────────────────────────────────────

    /**
     * @return id of the account that owns every scraped property, created on first use
     */
    public long ensureSystemUser(String email, LocalDateTime now) {
        Optional<Long> existing = findUserId(email);
        if (existing.isPresent()) {
            return existing.get();
        }
        jdbc.update("""
                INSERT INTO users (email, full_name, role, created_at)
                VALUES (:email, 'Listing Scraper', 'SYSTEM', :now)
                """,
                new MapSqlParameterSource()
                        .addValue("email", email)
                        .addValue("now", now));
        return findUserId(email).orElseThrow(() -> new IllegalStateException("System user " + email + " was not created"));
    }

    private Optional<Long> findUserId(String email) {
        return jdbc.queryForList("SELECT id FROM users WHERE email = :email", Map.of("email", email), Long.class)
                .stream().findFirst();
    }

    // ── Images ───────────────────────────────────────────────────────────────

    /**
     * Replace images by ordinal: existing ordinals are overwritten, new ones inserted, surplus
     * ones removed. Afterwards exactly one image of the property is primary. A mirrored copy
     * stays recorded while its ordinal keeps the same URL.
     */
    public void replaceImages(long propertyId, List<ListingImage> images) {
        int primaryOrdinal = 0;
        for (ListingImage image : images) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("property_id", propertyId)
                    .addValue("sort_order", image.ordinal())
                    .addValue("image_url", image.url())
                    .addValue("local_path", image.localPath());
            int updated = jdbc.update("""
                    UPDATE property_images SET
                        local_path = CASE WHEN image_url = :image_url THEN COALESCE(:local_path, local_path)
                                          ELSE :local_path END,
                        image_url = :image_url
                    WHERE property_id = :property_id AND sort_order = :sort_order
                    """, params);
            if (updated == 0) {
                jdbc.update("""
                        INSERT INTO property_images (property_id, image_url, local_path, sort_order, is_primary)
                        VALUES (:property_id, :image_url, :local_path, :sort_order, FALSE)
                        """, params);
            }
            if (image.primary()) {
                primaryOrdinal = image.ordinal();
            }
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("property_id", propertyId)
                .addValue("count", images.size())
                .addValue("primary_ordinal", primaryOrdinal);
        jdbc.update("DELETE FROM property_images WHERE property_id = :property_id AND sort_order >= :count", params);
        jdbc.update("""
                UPDATE property_images SET is_primary = (sort_order = :primary_ordinal)
                WHERE property_id = :property_id
                """, params);
    }

    /**
     * Point stored images at their mirrored copies. Images without a copy are left as they are.
     *
     * @return number of image rows updated
     */
    public int updateImageLocations(long propertyId, List<ListingImage> images) {
        int updated = 0;
        for (ListingImage image : images) {
            if (image.localPath() == null) {
                continue;
            }
            updated += jdbc.update("""
                    UPDATE property_images SET local_path = :local_path
                    WHERE property_id = :property_id AND image_url = :image_url
                    """, new MapSqlParameterSource()
                    .addValue("property_id", propertyId)
                    .addValue("image_url", image.url())
                    .addValue("local_path", image.localPath()));
        }
        return updated;
    }

    public List<ListingImage> findImages(long propertyId) {
        return jdbc.query("""
                        SELECT image_url, sort_order, is_primary, local_path FROM property_images
                        WHERE property_id = :property_id ORDER BY sort_order
                        """,
                Map.of("property_id", propertyId),
                (rs, rowNum) -> new ListingImage(rs.getString("image_url"), rs.getInt("sort_order"),
                        rs.getBoolean("is_primary"), rs.getString("local_path")));
    }

    // ── Parameters ───────────────────────────────────────────────────────────

    /**
     * Upsert each parameter into the catalogue, then its value for the property.
     */
    public void upsertParameters(long propertyId, List<ListingParameter> parameters, LocalDateTime now) {
        for (ListingParameter parameter : parameters) {
            long catalogueId = upsertCatalogueEntry(parameter, now);
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("property_id", propertyId)
                    .addValue("parameter_id", catalogueId)
                    .addValue("param_value", parameter.value());
            int updated = jdbc.update("""
                    UPDATE property_parameters SET param_value = :param_value
                    WHERE property_id = :property_id AND parameter_id = :parameter_id
                    """, params);
            if (updated == 0) {
                jdbc.update("""
                        INSERT INTO property_parameters (property_id, parameter_id, param_value)
                        VALUES (:property_id, :parameter_id, :param_value)
                        """, params);
            }
        }
    }

    private long upsertCatalogueEntry(ListingParameter parameter, LocalDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("external_id", parameter.parameterId())
                .addValue("param_key", parameter.key())
                .addValue("now", now);
        int updated = jdbc.update("UPDATE parameters SET param_key = :param_key WHERE external_id = :external_id", params);
        if (updated == 0) {
            jdbc.update("""
                    INSERT INTO parameters (external_id, param_key, created_at)
                    VALUES (:external_id, :param_key, :now)
                    """, params);
        }
        return jdbc.queryForObject("SELECT id FROM parameters WHERE external_id = :external_id", params, Long.class);
    }

    public int countParameters(long propertyId) {
        return count("SELECT COUNT(*) FROM property_parameters WHERE property_id = :property_id", propertyId);
    }

    // ── Amenities ────────────────────────────────────────────────────────────

    public void upsertAmenities(long propertyId, List<String> amenityKeys) {
        Set<String> existing = new HashSet<>(jdbc.queryForList(
                "SELECT amenity_key FROM property_amenities WHERE property_id = :property_id",
                Map.of("property_id", propertyId), String.class));
        for (String key : amenityKeys) {
            if (existing.add(key)) {
                jdbc.update("INSERT INTO property_amenities (property_id, amenity_key) VALUES (:property_id, :amenity_key)",
                        new MapSqlParameterSource()
                                .addValue("property_id", propertyId)
                                .addValue("amenity_key", key));
            }
        }
    }

    public int countAmenities(long propertyId) {
        return count("SELECT COUNT(*) FROM property_amenities WHERE property_id = :property_id", propertyId);
    }

    // ── Price history ────────────────────────────────────────────────────────

    public Optional<PricePoint> currentPrice(long propertyId) {
        return jdbc.query("""
                        SELECT price, currency FROM property_prices
                        WHERE property_id = :property_id
                        ORDER BY id DESC
                        LIMIT 1
                        """,
                Map.of("property_id", propertyId),
                (rs, rowNum) -> new PricePoint(rs.getBigDecimal("price"), Currency.valueOf(rs.getString("currency"))))
                .stream().findFirst();
    }

    public void appendPrice(long propertyId, BigDecimal price, Currency currency, BigDecimal priceUsd, LocalDateTime now) {
        jdbc.update("""
                INSERT INTO property_prices (property_id, price, currency, price_usd, recorded_at)
                VALUES (:property_id, :price, :currency, :price_usd, :now)
                """,
                new MapSqlParameterSource()
                        .addValue("property_id", propertyId)
                        .addValue("price", price)
                        .addValue("currency", currency.name())
                        .addValue("price_usd", priceUsd)
                        .addValue("now", now));
    }

    public int countPrices(long propertyId) {
        return count("SELECT COUNT(*) FROM property_prices WHERE property_id = :property_id", propertyId);
    }

    private int count(String sql, long propertyId) {
        Integer count = jdbc.queryForObject(sql, Map.of("property_id", propertyId), Integer.class);
        return count == null ? 0 : count;
    }
}
