package com.example.kvdriver.redis;

import com.example.kvdriver.driver.ConnectionManager;
import com.example.kvdriver.driver.RemoteDriver;
import com.example.kvdriver.driver.Row;
import com.example.kvdriver.driver.RowLookup;
import com.example.kvdriver.driver.TableNaming;
import com.example.kvdriver.driver.TableRegistry;
import com.example.kvdriver.driver.exceptions.BackendQueryException;
import com.example.kvdriver.model.KvDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import static com.example.kvdriver.model.KvDocument.DATA;

/**
 * {@link RemoteDriver} backed by Redis. Every entry is a hash stored at
 * {@code <namespace>:<table>:<key>} holding {@code ID}, {@code data} (JSON),
 * {@code createdAt}, {@code updatedAt} and {@code expireAt}. Expiry uses Redis key
 * expiration, so expired entries are never returned.
 * <p>
 * {@code data} is written as {@code {"v": <value>}} with Jackson type ids on every value
 * that JSON alone would not bring back as the same Java type, such as {@code Long} or
 * {@code BigDecimal}. Values are first converted to plain maps, lists and scalars.
 */
public class RedisDriver implements RemoteDriver {

    private static final Logger logger = LoggerFactory.getLogger(RedisDriver.class);

    // HSET ID/data/updatedAt, keep the first createdAt, then set or clear the expiry
    static final RedisScript<Long> UPSERT = new DefaultRedisScript<>(
            "redis.call('HSET', KEYS[1], 'ID', ARGV[1], 'data', ARGV[2], 'updatedAt', ARGV[3]) "
                    + "redis.call('HSETNX', KEYS[1], 'createdAt', ARGV[3]) "
                    + "if ARGV[4] == '' then "
                    + "redis.call('HDEL', KEYS[1], 'expireAt') "
                    + "redis.call('PERSIST', KEYS[1]) "
                    + "else "
                    + "redis.call('HSET', KEYS[1], 'expireAt', ARGV[4]) "
                    + "redis.call('PEXPIREAT', KEYS[1], ARGV[4]) "
                    + "end "
                    + "return 1",
            Long.class);

    private static final String VALUE = "v";

    private final RedisDriverOptions options;
    private final RedisConnector connector;
    private final ObjectMapper objectMapper;
    private final ObjectMapper typedMapper;
    private final TableNaming naming;
    private final ConnectionManager<RedisHandle> connection = new ConnectionManager<>("RedisDriver");
    private final TableRegistry<String> keyPrefixes = new TableRegistry<>();

    public RedisDriver(RedisDriverOptions options) {
        this(options, RedisConnector.standard(), new ObjectMapper());
    }

    public RedisDriver(RedisDriverOptions options, RedisConnector connector, ObjectMapper objectMapper) {
        this.options = Objects.requireNonNull(options, "options");
        this.connector = connector;
        this.objectMapper = objectMapper;
        this.typedMapper = objectMapper.copy().activateDefaultTyping(
                BasicPolymorphicTypeValidator.builder()
                        .allowIfSubType("java.lang.")
                        .allowIfSubType("java.util.")
                        .allowIfSubType("java.math.")
                        .build(),
                ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT);
        this.naming = TableNaming.of(options.isPluralizeNames());
    }

    @Override
    public RedisDriver connect() {
        connection.open(() -> connector.open(options));
        return this;
    }

    @Override
    public void disconnect() {
        keyPrefixes.invalidate();
        connection.close(h -> h.getConnectionFactory().destroy());
    }

    @Override
    public boolean isConnected() {
        return connection.isConnected();
    }

    @Override
    public void prepare(String table) {
        keyPrefix(table);
    }

    String keyPrefix(String table) {
        connection.require();
        String collection = naming.collectionName(table);
        if (collection.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Redis table names must not contain ':' but got " + table);
        }
        return keyPrefixes.resolve(table, t -> {
            logger.info("Registered table {} under key prefix {}:{}:", t, options.getNamespace(), collection);
            return options.getNamespace() + ":" + collection + ":";
        });
    }

    @Override
    public List<Row> getAllRows(String table) {
        StringRedisTemplate template = connection.require().getTemplate();
        String prefix = keyPrefix(table);
        return run("getAllRows", table, () -> readRows(template, table, prefix, ""));
    }

    @Override
    public RowLookup getRowByKey(String table, String key) {
        Objects.requireNonNull(key, "key");
        StringRedisTemplate template = connection.require().getTemplate();
        String prefix = keyPrefix(table);
        Object json = run("getRowByKey", table, () -> template.opsForHash().get(prefix + key, DATA));
        return json == null ? RowLookup.absent() : RowLookup.of(decode(table, (String) json));
    }

    @Override
    public List<Row> getStartsWith(String table, String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        StringRedisTemplate template = connection.require().getTemplate();
        String keyPrefix = keyPrefix(table);
        return run("getStartsWith", table, () -> readRows(template, table, keyPrefix, prefix));
    }

    @Override
    public Object setRowByKey(String table, String key, Object value, boolean update, Instant expireAt) {
        Objects.requireNonNull(key, "key");
        StringRedisTemplate template = connection.require().getTemplate();
        String prefix = keyPrefix(table);
        String json = encode(value);
        String now = Long.toString(System.currentTimeMillis());
        String expiry = expireAt == null ? "" : Long.toString(expireAt.toEpochMilli());
        run("setRowByKey", table, () -> template.execute(UPSERT, List.of(prefix + key), key, json, now, expiry));
        logger.debug("Upserted {}{}", prefix, key);
        return value;
    }

    @Override
    public long deleteAllRows(String table) {
        StringRedisTemplate template = connection.require().getTemplate();
        String prefix = keyPrefix(table);
        return run("deleteAllRows", table, () -> {
            Set<String> keys = scanKeys(template, prefix);
            if (keys.isEmpty()) {
                return 0L;
            }
            Long deleted = template.delete(keys);
            return deleted == null ? 0L : deleted;
        });
    }

    @Override
    public long deleteRowByKey(String table, String key) {
        Objects.requireNonNull(key, "key");
        StringRedisTemplate template = connection.require().getTemplate();
        String prefix = keyPrefix(table);
        Boolean deleted = run("deleteRowByKey", table, () -> template.delete(prefix + key));
        return Boolean.TRUE.equals(deleted) ? 1L : 0L;
    }

    private List<Row> readRows(StringRedisTemplate template, String table, String keyPrefix, String idPrefix) {
        List<Row> rows = new ArrayList<>();
        for (String redisKey : scanKeys(template, keyPrefix + idPrefix)) {
            Object json = template.opsForHash().get(redisKey, DATA);
            // expired or deleted between SCAN and HGET
            if (json == null) {
                continue;
            }
            rows.add(new Row(redisKey.substring(keyPrefix.length()), decode(table, (String) json)));
        }
        return rows;
    }

    // SCAN may return a key more than once
    private Set<String> scanKeys(StringRedisTemplate template, String literalPrefix) {
        ScanOptions scan = ScanOptions.scanOptions()
                .match(escapeGlob(literalPrefix) + "*")
                .count(options.getScanCount())
                .build();
        Set<String> keys = new LinkedHashSet<>();
        try (Cursor<String> cursor = template.scan(scan)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        return keys;
    }

    /** Escapes the glob metacharacters of a SCAN MATCH pattern. */
    static String escapeGlob(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    String encode(Object value) {
        try {
            Object plain = KvDocument.plainValue(objectMapper.convertValue(value, Object.class));
            return typedMapper.writeValueAsString(Collections.singletonMap(VALUE, plain));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be stored as JSON: " + e.getMessage(), e);
        }
    }

    Object decode(String table, String json) {
        try {
            Map<?, ?> envelope = typedMapper.readValue(json, Map.class);
            if (envelope == null || !envelope.containsKey(VALUE)) {
                throw new BackendQueryException("decode", table,
                        new IllegalStateException("stored data has no '" + VALUE + "' field"));
            }
            return envelope.get(VALUE);
        } catch (JsonProcessingException e) {
            throw new BackendQueryException("decode", table, e);
        }
    }

    private static <T> T run(String operation, String table, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new BackendQueryException(operation, table, e);
        }
    }
}
