package com.example.kvdriver.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Opens a {@link MongoConnection} for a connection string.
 */
@FunctionalInterface
public interface MongoConnector {

    MongoConnection open(String url, MongoDriverOptions options) throws Exception;

    /**
     * Creates a client from the connection string and options and pings the server, so a
     * bad target or bad credentials fail here rather than on the first query.
     */
    static MongoConnector standard() {
        return (url, options) -> {
            ConnectionString target = new ConnectionString(url);
            MongoClientSettings.Builder settings = MongoClientSettings.builder()
                    .applyConnectionString(target);
            if (options.getConnectTimeout() != null) {
                long millis = options.getConnectTimeout().toMillis();
                settings.applyToSocketSettings(b -> b.connectTimeout(millis, TimeUnit.MILLISECONDS));
            }
            if (options.getServerSelectionTimeout() != null) {
                long millis = options.getServerSelectionTimeout().toMillis();
                settings.applyToClusterSettings(b -> b.serverSelectionTimeout(millis, TimeUnit.MILLISECONDS));
            }
            if (options.getMaxPoolSize() != null) {
                int maxSize = options.getMaxPoolSize();
                settings.applyToConnectionPoolSettings(b -> b.maxSize(maxSize));
            }
            if (options.getApplicationName() != null) {
                settings.applicationName(options.getApplicationName());
            }

            String database = options.getDatabase() != null ? options.getDatabase()
                    : target.getDatabase() != null ? target.getDatabase()
                    : MongoDriverOptions.DEFAULT_DATABASE;

            MongoClient client = MongoClients.create(settings.build());
            try {
                MongoTemplate template = new MongoTemplate(client, database);
                template.executeCommand(new Document("ping", 1));
                return new MongoConnection(client, template, database);
            } catch (RuntimeException e) {
                client.close();
                throw e;
            }
        };
    }
}
