package com.example.kvdriver.mongo;

import com.mongodb.client.MongoClient;
import lombok.Value;
import org.springframework.data.mongodb.core.MongoTemplate;

/** The live client of a connected {@link MongoDriver} and the template bound to its database. */
@Value
public class MongoConnection {
    MongoClient client;
    MongoTemplate template;
    String database;
}
