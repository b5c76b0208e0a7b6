package com.example.kvdriver.redis;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class RedisDriverOptions {

    @Builder.Default
    String host = "localhost";

    @Builder.Default
    int port = 6379;

    String password;

    @Builder.Default
    int database = 0;

    /** First segment of every entry key, {@code <namespace>:<table>:<key>}. */
    @Builder.Default
    String namespace = "kv";

    @Builder.Default
    boolean pluralizeNames = false;

    Duration commandTimeout;

    /** COUNT hint passed to SCAN. */
    @Builder.Default
    int scanCount = 100;

    public static RedisDriverOptions defaults() {
        return builder().build();
    }
}
