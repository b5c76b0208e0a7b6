package com.example.kvdriver.mongo;

import com.example.kvdriver.driver.ConnectionManager;
import com.example.kvdriver.driver.RemoteDriver;
import com.example.kvdriver.driver.Row;
import com.example.kvdriver.driver.RowLookup;
import com.example.kvdriver.driver.TableNaming;
import com.example.kvdriver.driver.TableRegistry;
import com.example.kvdriver.driver.exceptions.BackendQueryException;
import com.example.kvdriver.model.KvDocument;
import com.mongodb.MongoException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.example.kvdriver.model.KvDocument.CREATED_AT;
import static com.example.kvdriver.model.KvDocument.DATA;
import static com.example.kvdriver.model.KvDocument.EXPIRE_AT;
import static com.example.kvdriver.model.KvDocument.ID;
import static com.example.kvdriver.model.KvDocument.UPDATED_AT;
import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * {@link RemoteDriver} backed by MongoDB. Each KV table maps to one collection whose
 * documents look like {@code {ID, data, createdAt, updatedAt, expireAt?}}.
 *
 * <pre>{@code
 * RemoteDriver driver = new MongoDriver("mongodb://localhost/quickdb").connect();
 * driver.setRowByKey("cache", "session:42", Map.of("uid", 7), false);
 * driver.getRowByKey("cache", "session:42"); // ({uid=7}, true)
 * }</pre>
 */
public class MongoDriver implements RemoteDriver {

    private static final Logger logger = LoggerFactory.getLogger(MongoDriver.class);

    private final String url;
    private final MongoDriverOptions options;
    private final MongoConnector connector;
    private final Executor indexExecutor;
    private final TableNaming naming;
    private final ConnectionManager<MongoConnection> connection = new ConnectionManager<>("MongoDriver");
    private final TableRegistry<MongoTable> tables = new TableRegistry<>();

    public MongoDriver(String url) {
        this(url, MongoDriverOptions.defaults());
    }

    public MongoDriver(String url, MongoDriverOptions options) {
        this(url, options, MongoConnector.standard(), ForkJoinPool.commonPool());
    }

    MongoDriver(String url, MongoDriverOptions options, MongoConnector connector, Executor indexExecutor) {
        this.url = Objects.requireNonNull(url, "url");
        this.options = Objects.requireNonNull(options, "options");
        this.connector = connector;
        this.indexExecutor = indexExecutor;
        this.naming = TableNaming.of(options.isPluralizeNames());
    }

    @Override
    public MongoDriver connect() {
        connection.open(() -> connector.open(url, options));
        return this;
    }

    @Override
    public void disconnect() {
        tables.invalidate();
        connection.close(c -> c.getClient().close());
    }

    @Override
    public boolean isConnected() {
        return connection.isConnected();
    }

    @Override
    public void prepare(String table) {
        getModel(table);
    }

    /** Names of the tables that have a handle on the current connection. */
    public Set<String> getPreparedTables() {
        return tables.tables();
    }

    MongoTable getModel(String table) {
        MongoConnection conn = connection.require();
        String collection = naming.collectionName(table);
        return tables.resolve(table, name -> new MongoTable(name, collection, conn.getTemplate(), indexExecutor));
    }

    @Override
    public List<Row> getAllRows(String table) {
        MongoTemplate template = connection.require().getTemplate();
        MongoTable model = getModel(table);
        Query query = new Query(live(Instant.now()));
        return run("getAllRows", table, () -> toRows(template.find(query, Document.class, model.getCollection())));
    }

    @Override
    public RowLookup getRowByKey(String table, String key) {
        Objects.requireNonNull(key, "key");
        MongoTemplate template = connection.require().getTemplate();
        MongoTable model = getModel(table);
        Query query = new Query(new Criteria().andOperator(where(ID).is(key), live(Instant.now())));
        Document found = run("getRowByKey", table, () -> template.findOne(query, Document.class, model.getCollection()));
        return found == null ? RowLookup.absent() : RowLookup.of(KvDocument.fromBson(found).getData());
    }

    @Override
    public List<Row> getStartsWith(String table, String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        MongoTemplate template = connection.require().getTemplate();
        MongoTable model = getModel(table);
        Query query = new Query(new Criteria().andOperator(
                where(ID).regex(startsWith(prefix)),
                live(Instant.now())));
        return run("getStartsWith", table, () -> toRows(template.find(query, Document.class, model.getCollection())));
    }

    @Override
    public Object setRowByKey(String table, String key, Object value, boolean update, Instant expireAt) {
        Objects.requireNonNull(key, "key");
        MongoTemplate template = connection.require().getTemplate();
        MongoTable model = getModel(table);
        Date now = new Date();
        Update write = new Update()
                .set(DATA, value)
                .set(EXPIRE_AT, expireAt == null ? null : Date.from(expireAt))
                .set(UPDATED_AT, now)
                .setOnInsert(CREATED_AT, now);
        run("setRowByKey", table, () -> template.upsert(new Query(where(ID).is(key)), write, model.getCollection()));
        logger.debug("Upserted {} in {}", key, model.getCollection());
        return value;
    }

    @Override
    public long deleteAllRows(String table) {
        MongoTemplate template = connection.require().getTemplate();
        MongoTable model = getModel(table);
        return run("deleteAllRows", table, () -> template.remove(new Query(), model.getCollection()).getDeletedCount());
    }

    @Override
    public long deleteRowByKey(String table, String key) {
        Objects.requireNonNull(key, "key");
        MongoTemplate template = connection.require().getTemplate();
        MongoTable model = getModel(table);
        return run("deleteRowByKey", table,
                () -> template.remove(new Query(where(ID).is(key)), model.getCollection()).getDeletedCount());
    }

    /** Anchored regex matching keys that begin with {@code prefix} taken literally. */
    static String startsWith(String prefix) {
        return "^" + Pattern.quote(prefix);
    }

    // expireAt: null also matches documents written before the field existed
    private static Criteria live(Instant now) {
        return new Criteria().orOperator(
                where(EXPIRE_AT).is(null),
                where(EXPIRE_AT).gt(Date.from(now)));
    }

    private static List<Row> toRows(List<Document> docs) {
        return docs.stream()
                .map(KvDocument::fromBson)
                .map(d -> new Row(d.getId(), d.getData()))
                .collect(Collectors.toList());
    }

    private static <T> T run(String operation, String table, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | MongoException e) {
            throw new BackendQueryException(operation, table, e);
        }
    }
}
