package com.example.kvdriver.config;

import com.example.kvdriver.driver.AsyncRemoteDriver;
import com.example.kvdriver.driver.RemoteDriver;
import com.example.kvdriver.memory.MemoryDriver;
import com.example.kvdriver.memory.MemoryStore;
import com.example.kvdriver.mongo.MongoDriver;
import com.example.kvdriver.mongo.MongoDriverOptions;
import com.example.kvdriver.redis.RedisConnector;
import com.example.kvdriver.redis.RedisDriver;
import com.example.kvdriver.redis.RedisDriverOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Builds the configured {@link RemoteDriver}. The container connects it on startup and
 * disconnects it on shutdown.
 */
@Configuration
public class KvDriverConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(KvDriverConfiguration.class);

    @Value("${app.driver.backend:mongo}")
    private String backend;

    @Value("${app.driver.pluralize-names:false}")
    private boolean pluralizeNames;

    @Value("${app.driver.mongo.uri:mongodb://localhost:27017/quickdb}")
    private String mongoUri;

    @Value("${app.driver.mongo.database:}")
    private String mongoDatabase;

    @Value("${app.driver.mongo.connect-timeout-ms:10000}")
    private long mongoConnectTimeoutMs;

    @Value("${app.driver.mongo.server-selection-timeout-ms:30000}")
    private long mongoServerSelectionTimeoutMs;

    @Value("${app.driver.mongo.max-pool-size:0}")
    private int mongoMaxPoolSize;

    @Value("${app.driver.redis.host:localhost}")
    private String redisHost;

    @Value("${app.driver.redis.port:6379}")
    private int redisPort;

    @Value("${app.driver.redis.password:}")
    private String redisPassword;

    @Value("${app.driver.redis.database:0}")
    private int redisDatabase;

    @Value("${app.driver.redis.namespace:kv}")
    private String redisNamespace;

    @Value("${app.driver.memory.sweep-interval-ms:1000}")
    private long memorySweepIntervalMs;

    @Value("${app.driver.async.threads:4}")
    private int asyncThreads;

    @Value("${spring.application.name:kv-driver}")
    private String applicationName;

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "app.driver.backend", havingValue = "memory")
    public MemoryStore memoryStore() {
        return new MemoryStore(Duration.ofMillis(memorySweepIntervalMs), Clock.systemUTC());
    }

    @Bean(initMethod = "connect", destroyMethod = "disconnect")
    public RemoteDriver remoteDriver(ObjectMapper objectMapper, ObjectProvider<MemoryStore> memoryStore) {
        RemoteDriver driver = createDriver(objectMapper, memoryStore::getObject);
        logger.info("Using {} backend (pluralizeNames={})", backend, pluralizeNames);
        return driver;
    }

    @Bean(destroyMethod = "close")
    public AsyncRemoteDriver asyncRemoteDriver(RemoteDriver remoteDriver) {
        return new AsyncRemoteDriver(remoteDriver, asyncThreads);
    }

    RemoteDriver createDriver(ObjectMapper objectMapper, Supplier<MemoryStore> memoryStore) {
        switch (backend.toLowerCase(Locale.ROOT)) {
            case "mongo":
                return new MongoDriver(mongoUri, MongoDriverOptions.builder()
                        .database(mongoDatabase.isBlank() ? null : mongoDatabase)
                        .pluralizeNames(pluralizeNames)
                        .connectTimeout(Duration.ofMillis(mongoConnectTimeoutMs))
                        .serverSelectionTimeout(Duration.ofMillis(mongoServerSelectionTimeoutMs))
                        .maxPoolSize(mongoMaxPoolSize > 0 ? mongoMaxPoolSize : null)
                        .applicationName(applicationName)
                        .build());
            case "redis":
                return new RedisDriver(RedisDriverOptions.builder()
                        .host(redisHost)
                        .port(redisPort)
                        .password(redisPassword.isEmpty() ? null : redisPassword)
                        .database(redisDatabase)
                        .namespace(redisNamespace)
                        .pluralizeNames(pluralizeNames)
                        .build(),
                        RedisConnector.standard(),
                        objectMapper);
            case "memory":
                return new MemoryDriver(memoryStore.get(), pluralizeNames);
            default:
                throw new IllegalArgumentException("Unknown driver backend: " + backend + " (expected mongo, redis or memory)");
        }
    }

    public String getBackend() {
        return backend;
    }
}
