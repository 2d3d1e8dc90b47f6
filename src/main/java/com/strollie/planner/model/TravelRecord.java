package com.strollie.planner.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.strollie.planner.engine.geo.GeoPoint;
import com.strollie.planner.error.ValidationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A lodging listing or an attraction. Name, city and coordinates are typed; every other
 * domain field (price, rating, room_type, category, ...) lives in {@link #attributes}.
 * Coordinates may be absent, such a record is skipped by proximity operations.
 */
@Value
@Builder(toBuilder = true)
@Schema(name = "TravelRecord", description = "Listing or attraction with coordinates and free-form attributes")
public class TravelRecord implements FieldSource {

    public static final String NAME = "name";
    public static final String CITY = "city";
    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";

    @Schema(description = "Name", example = "Cozy studio near Louvre")
    String name;
    @Schema(description = "City", example = "Paris")
    String city;
    @Schema(description = "Latitude", example = "48.8606")
    Double latitude;
    @Schema(description = "Longitude", example = "2.3376")
    Double longitude;
    @Singular
    Map<String, Object> attributes;

    /**
     * Builds a record from a loosely-typed row such as a JSON object or a database row.
     */
    public static TravelRecord fromFields(Map<String, ?> fields) {
        TravelRecordBuilder builder = TravelRecord.builder()
                .name(asText(fields.get(NAME)))
                .city(asText(fields.get(CITY)))
                .latitude(asCoordinate(LATITUDE, fields.get(LATITUDE)))
                .longitude(asCoordinate(LONGITUDE, fields.get(LONGITUDE)));

        fields.forEach((key, value) -> {
            if (!isTypedField(key) && value != null) {
                builder.attribute(key, value);
            }
        });
        return builder.build();
    }

    @JsonIgnore
    public Optional<GeoPoint> getCoordinates() {
        if (latitude == null || longitude == null) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(latitude, longitude));
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public Optional<Object> field(String fieldName) {
        return switch (fieldName) {
            case NAME -> Optional.ofNullable(name);
            case CITY -> Optional.ofNullable(city);
            case LATITUDE -> Optional.ofNullable(latitude);
            case LONGITUDE -> Optional.ofNullable(longitude);
            default -> Optional.ofNullable(attributes.get(fieldName));
        };
    }

    @Override
    public Set<String> fieldNames() {
        Set<String> names = new LinkedHashSet<>();
        if (name != null) names.add(NAME);
        if (city != null) names.add(CITY);
        if (latitude != null) names.add(LATITUDE);
        if (longitude != null) names.add(LONGITUDE);
        names.addAll(attributes.keySet());
        return Collections.unmodifiableSet(names);
    }

    public boolean inCity(String otherCity) {
        return city != null && otherCity != null && city.trim().equalsIgnoreCase(otherCity.trim());
    }

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(NAME, name);
        fields.put(CITY, city);
        fields.put(LATITUDE, latitude);
        fields.put(LONGITUDE, longitude);
        fields.putAll(attributes);
        return fields;
    }

    private static boolean isTypedField(String key) {
        return NAME.equals(key) || CITY.equals(key) || LATITUDE.equals(key) || LONGITUDE.equals(key);
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }

    private static Double asCoordinate(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ValidationException("Field '" + field + "' is not a number: " + text, e);
        }
    }
}
