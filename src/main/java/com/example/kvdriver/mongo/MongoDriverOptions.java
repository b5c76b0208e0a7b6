package com.example.kvdriver.mongo;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Connection options recognized by {@link MongoDriver}. Unset values fall back to the
 * connection string, then to the MongoDB client defaults.
 */
@Value
@Builder(toBuilder = true)
public class MongoDriverOptions {

    public static final String DEFAULT_DATABASE = "quickdb";

    /** Database holding the KV collections; when null, the one named in the URI, else {@value #DEFAULT_DATABASE}. */
    String database;

    @Builder.Default
    boolean pluralizeNames = false;

    Duration connectTimeout;

    Duration serverSelectionTimeout;

    Integer maxPoolSize;

    String applicationName;

    public static MongoDriverOptions defaults() {
        return builder().build();
    }
}
