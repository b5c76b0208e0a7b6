package com.example.kvdriver.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One stored KV entry: the key, its opaque value, timestamps and an optional expiry.
 * The persisted layout is {@code {ID, data, createdAt, updatedAt, expireAt?}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KvDocument {

    public static final String ID = "ID";
    public static final String DATA = "data";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";
    public static final String EXPIRE_AT = "expireAt";

    private String id;
    private Object data;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expireAt;

    public boolean isExpired(Instant now) {
        return expireAt != null && !expireAt.isAfter(now);
    }

    public static KvDocument fromBson(Document doc) {
        return KvDocument.builder()
                .id(doc.getString(ID))
                .data(plainValue(doc.get(DATA)))
                .createdAt(instant(doc.get(CREATED_AT)))
                .updatedAt(instant(doc.get(UPDATED_AT)))
                .expireAt(instant(doc.get(EXPIRE_AT)))
                .build();
    }

    /**
     * Deep-copies maps (BSON documents included) and collections into plain
     * {@code LinkedHashMap}s and {@code ArrayList}s, so values read back compare equal to
     * the ones that were written. Scalars are returned as is.
     */
    public static Object plainValue(Object value) {
        if (value instanceof Map) {
            return plainMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(plainValue(item));
            }
            return copy;
        }
        return value;
    }

    private static Map<String, Object> plainMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), plainValue(v)));
        return copy;
    }

    private static Instant instant(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        return null;
    }
}
