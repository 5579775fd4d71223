package com.agentgateway.backend.support;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Base class for store tests that need a real MongoDB; skipped without Docker. */
@Testcontainers(disabledWithoutDocker = true)
public abstract class MongoTestContainer {

  protected static final String DATABASE = "agent_gateway_test";

  @Container
  @SuppressWarnings("resource")
  protected static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

  protected static MongoClient createClient() {
    return MongoClients.create(MONGO.getReplicaSetUrl());
  }

  protected static MongoTemplate createTemplate(MongoClient client) {
    return new MongoTemplate(client, DATABASE);
  }
}
