package com.propertyintel.listing.persistence;

import com.propertyintel.listing.model.Currency;
import com.propertyintel.listing.model.DealType;
import com.propertyintel.listing.model.Language;
import com.propertyintel.listing.model.NormalizedListing;
import com.propertyintel.listing.model.OwnerType;
import com.propertyintel.listing.model.PersistedProperty;
import com.propertyintel.listing.model.PropertyType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the {@code properties} table. Children live in {@link ListingChildRepository}.
 */
@Repository
@RequiredArgsConstructor
public class PropertyRepository {

    private static final String SELECT_PROPERTY = "SELECT * FROM properties ";

    private final NamedParameterJdbcTemplate jdbc;

    // ── Lookups ──────────────────────────────────────────────────────────────

    public Optional<PersistedProperty> findByExternalKey(String externalId, String source) {
        return jdbc.query(SELECT_PROPERTY + "WHERE external_id = :external_id AND source = :source",
                        new MapSqlParameterSource()
                                .addValue("external_id", externalId)
                                .addValue("source", source),
                        PROPERTY_MAPPER)
                .stream().findFirst();
    }

    public Optional<PersistedProperty> findById(long id) {
        return jdbc.query(SELECT_PROPERTY + "WHERE id = :id", Map.of("id", id), PROPERTY_MAPPER)
                .stream().findFirst();
    }

    /**
     * Rows of one source in the same city and district, the candidate pool for address matching.
     */
    public List<PersistedProperty> findInArea(String source, String city, String district) {
        StringBuilder sql = new StringBuilder(SELECT_PROPERTY).append("WHERE source = :source AND address IS NOT NULL");
        MapSqlParameterSource params = new MapSqlParameterSource("source", source);
        appendNullSafe(sql, params, "city", city);
        appendNullSafe(sql, params, "district", district);
        return jdbc.query(sql.toString(), params, PROPERTY_MAPPER);
    }

    /**
     * Rows of one source inside a square of {@code precision} degrees around a point.
     */
    public List<PersistedProperty> findNear(String source, double latitude, double longitude, double precision) {
        return jdbc.query(SELECT_PROPERTY + """
                        WHERE source = :source
                          AND latitude BETWEEN :min_lat AND :max_lat
                          AND longitude BETWEEN :min_lng AND :max_lng
                        """,
                new MapSqlParameterSource()
                        .addValue("source", source)
                        .addValue("min_lat", latitude - precision)
                        .addValue("max_lat", latitude + precision)
                        .addValue("min_lng", longitude - precision)
                        .addValue("max_lng", longitude + precision),
                PROPERTY_MAPPER);
    }

    public int count() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM properties", Map.of(), Integer.class);
        return count == null ? 0 : count;
    }

    // ── Ingester writes ──────────────────────────────────────────────────────

    /**
     * @return the id of the new row
     * @throws org.springframework.dao.DuplicateKeyException when (external_id, source) already exists
     */
    public long insert(NormalizedListing listing, long ownerId, LocalDateTime now) {
        MapSqlParameterSource params = listingParams(listing, listing.getTitles(), listing.getDescriptions())
                .addValue("owner_id", ownerId)
                .addValue("now", now);
        jdbc.update("""
                INSERT INTO properties
                (external_id, source, owner_id, title_ka, title_en, title_ru,
                 description_ka, description_en, description_ru, price, currency, price_usd,
                 property_type, deal_type, owner_type, area, rooms, bedrooms, bathrooms,
                 floor_number, total_floors, address, city, district, urban_area, latitude, longitude,
                 version, created_at, updated_at, last_scraped)
                VALUES
                (:external_id, :source, :owner_id, :title_ka, :title_en, :title_ru,
                 :description_ka, :description_en, :description_ru, :price, :currency, :price_usd,
                 :property_type, :deal_type, :owner_type, :area, :rooms, :bedrooms, :bathrooms,
                 :floor_number, :total_floors, :address, :city, :district, :urban_area, :latitude, :longitude,
                 0, :now, :now, :now)
                """, params);
        return jdbc.queryForObject(
                "SELECT id FROM properties WHERE external_id = :external_id AND source = :source",
                params, Long.class);
    }

    /**
     * Overwrite a row with fresh listing data and bump its version. Identity columns
     * (external_id, source) are kept, so a fuzzy-matched row stays addressable by its original key.
     *
     * Text columns are written only when {@code textChanged}: then every language is replaced by
     * the incoming text and {@code translated_at} is cleared. Otherwise they are left out of the
     * statement, so a translation committed by the enrichment worker after this row was read
     * survives.
     */
    public void update(long id, NormalizedListing listing, boolean textChanged, LocalDateTime now) {
        MapSqlParameterSource params = listingParams(listing, listing.getTitles(), listing.getDescriptions())
                .addValue("id", id)
                .addValue("now", now);
        String text = textChanged ? """
                    title_ka = :title_ka, title_en = :title_en, title_ru = :title_ru,
                    description_ka = :description_ka, description_en = :description_en,
                    description_ru = :description_ru, translated_at = NULL,
                """ : "";
        jdbc.update("UPDATE properties SET " + text + """
                    price = :price, currency = :currency, price_usd = :price_usd,
                    property_type = :property_type, deal_type = :deal_type, owner_type = :owner_type,
                    area = :area, rooms = :rooms, bedrooms = :bedrooms, bathrooms = :bathrooms,
                    floor_number = :floor_number, total_floors = :total_floors,
                    address = :address, city = :city, district = :district, urban_area = :urban_area,
                    latitude = :latitude, longitude = :longitude,
                    version = version + 1, updated_at = :now, last_scraped = :now
                WHERE id = :id
                """, params);
    }

    /**
     * Record that a listing was seen without changing its data. The version is left alone so an
     * in-flight translation of the row is not invalidated.
     */
    public void touch(long id, LocalDateTime now) {
        jdbc.update("UPDATE properties SET last_scraped = :now WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("now", now));
    }

    // ── Enrichment ───────────────────────────────────────────────────────────

    /**
     * Ids that still need translation and are not leased by a live worker.
     */
    public List<Long> findUntranslated(LocalDateTime now, int limit) {
        return jdbc.queryForList("""
                SELECT id FROM properties
                WHERE translated_at IS NULL
                  AND (enrichment_lease_until IS NULL OR enrichment_lease_until < :now)
                ORDER BY id
                LIMIT :limit
                """,
                new MapSqlParameterSource()
                        .addValue("now", now)
                        .addValue("limit", limit),
                Long.class);
    }

    /**
     * Take the enrichment lease on one row.
     *
     * @return true only for the one caller whose conditional update hit the row
     */
    public boolean claim(long id, LocalDateTime now, LocalDateTime leaseUntil) {
        return jdbc.update("""
                UPDATE properties SET enrichment_lease_until = :lease_until
                WHERE id = :id
                  AND translated_at IS NULL
                  AND (enrichment_lease_until IS NULL OR enrichment_lease_until < :now)
                """,
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("now", now)
                        .addValue("lease_until", leaseUntil)) == 1;
    }

    /**
     * Store translations only if the row still carries the version read at claim time.
     *
     * @return false when an ingester update got there first
     */
    public boolean writeBack(long id, long expectedVersion, Map<Language, String> titles,
                             Map<Language, String> descriptions, LocalDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("version", expectedVersion)
                .addValue("now", now);
        StringBuilder sets = new StringBuilder();
        for (Language language : Language.values()) {
            if (language == Language.KA) {
                continue;
            }
            if (titles.containsKey(language)) {
                sets.append("title_").append(language.code()).append(" = :title_").append(language.code()).append(", ");
                params.addValue("title_" + language.code(), titles.get(language));
            }
            if (descriptions.containsKey(language)) {
                sets.append("description_").append(language.code()).append(" = :description_").append(language.code()).append(", ");
                params.addValue("description_" + language.code(), descriptions.get(language));
            }
        }
        return jdbc.update("UPDATE properties SET " + sets
                + "translated_at = :now, enrichment_lease_until = NULL WHERE id = :id AND version = :version", params) == 1;
    }

    public void releaseLease(long id) {
        jdbc.update("UPDATE properties SET enrichment_lease_until = NULL WHERE id = :id", Map.of("id", id));
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private MapSqlParameterSource listingParams(NormalizedListing l, Map<Language, String> titles,
                                                Map<Language, String> descriptions) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("external_id", l.getExternalId())
                .addValue("source", l.getSource())
                .addValue("price", l.getPrice())
                .addValue("currency", name(l.getCurrency()))
                .addValue("price_usd", l.getPriceUsd())
                .addValue("property_type", name(l.getPropertyType()))
                .addValue("deal_type", name(l.getDealType()))
                .addValue("owner_type", name(l.getOwnerType()))
                .addValue("area", l.getArea())
                .addValue("rooms", l.getRooms())
                .addValue("bedrooms", l.getBedrooms())
                .addValue("bathrooms", l.getBathrooms())
                .addValue("floor_number", l.getFloor())
                .addValue("total_floors", l.getTotalFloors())
                .addValue("address", l.getAddress())
                .addValue("city", l.getCity())
                .addValue("district", l.getDistrict())
                .addValue("urban_area", l.getUrbanArea())
                .addValue("latitude", l.getLatitude())
                .addValue("longitude", l.getLongitude());
        for (Language language : Language.values()) {
            params.addValue("title_" + language.code(), titles.get(language));
            params.addValue("description_" + language.code(), descriptions.get(language));
        }
        return params;
    }

    private static void appendNullSafe(StringBuilder sql, MapSqlParameterSource params, String column, String value) {
        if (value == null) {
            sql.append(" AND ").append(column).append(" IS NULL");
        } else {
            sql.append(" AND LOWER(").append(column).append(") = LOWER(:").append(column).append(")");
            params.addValue(column, value);
        }
    }

    private static String name(Enum<?> value) {
        return value == null ? null : value.name();
    }

    private static final RowMapper<PersistedProperty> PROPERTY_MAPPER = (rs, rowNum) -> {
        Map<Language, String> titles = new EnumMap<>(Language.class);
        Map<Language, String> descriptions = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            putIfPresent(titles, language, rs.getString("title_" + language.code()));
            putIfPresent(descriptions, language, rs.getString("description_" + language.code()));
        }
        return PersistedProperty.builder()
                .id(rs.getLong("id"))
                .externalId(rs.getString("external_id"))
                .source(rs.getString("source"))
                .ownerId(nullableLong(rs, "owner_id"))
                .titles(titles)
                .descriptions(descriptions)
                .price(rs.getBigDecimal("price"))
                .currency(enumOf(Currency.class, rs.getString("currency")))
                .priceUsd(rs.getBigDecimal("price_usd"))
                .propertyType(enumOf(PropertyType.class, rs.getString("property_type")))
                .dealType(enumOf(DealType.class, rs.getString("deal_type")))
                .ownerType(enumOf(OwnerType.class, rs.getString("owner_type")))
                .area(rs.getBigDecimal("area"))
                .rooms(rs.getObject("rooms", Integer.class))
                .bedrooms(rs.getObject("bedrooms", Integer.class))
                .bathrooms(rs.getObject("bathrooms", Integer.class))
                .floor(rs.getObject("floor_number", Integer.class))
                .totalFloors(rs.getObject("total_floors", Integer.class))
                .address(rs.getString("address"))
                .city(rs.getString("city"))
                .district(rs.getString("district"))
                .urbanArea(rs.getString("urban_area"))
                .latitude(rs.getObject("latitude", Double.class))
                .longitude(rs.getObject("longitude", Double.class))
                .version(rs.getLong("version"))
                .translatedAt(rs.getObject("translated_at", LocalDateTime.class))
                .enrichmentLeaseUntil(rs.getObject("enrichment_lease_until", LocalDateTime.class))
                .createdAt(rs.getObject("created_at", LocalDateTime.class))
                .updatedAt(rs.getObject("updated_at", LocalDateTime.class))
                .lastScraped(rs.getObject("last_scraped", LocalDateTime.class))
                .build();
    };

    private static void putIfPresent(Map<Language, String> map, Language language, String value) {
        if (value != null) {
            map.put(language, value);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static <E extends Enum<E>> E enumOf(Class<E> type, String value) {
        return value == null ? null : Enum.valueOf(type, value);
    }
}
