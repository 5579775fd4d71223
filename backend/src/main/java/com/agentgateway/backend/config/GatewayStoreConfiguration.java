package com.agentgateway.backend.config;

import com.agentgateway.backend.agent.persistence.MongoAgentConfigStore;
import com.agentgateway.backend.conversation.persistence.MongoConversationStore;
import com.agentgateway.backend.common.exception.StorageException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;
import org.springframework.data.mongodb.core.convert.MongoConverter;

/**
 * Builds the Mongo client from {@link GatewayProperties} instead of {@code spring.data.mongodb.*},
 * so the store can only come up with a validated URI and database name. Boot's Mongo
 * auto-configuration backs off for the beans declared here.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayStoreConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public MongoClient mongoClient(GatewayProperties properties) {
    return MongoClients.create(properties.getStore().getUri());
  }

  @Bean
  public MongoDatabaseFactory mongoDatabaseFactory(
      MongoClient mongoClient, GatewayProperties properties) {
    return new SimpleMongoClientDatabaseFactory(mongoClient, properties.getStore().getDatabase());
  }

  @Bean
  public MongoTemplate mongoTemplate(MongoDatabaseFactory databaseFactory, MongoConverter converter) {
    return new MongoTemplate(databaseFactory, converter);
  }

  @Bean
  public MongoAgentConfigStore agentConfigStore(
      MongoTemplate mongoTemplate, GatewayProperties properties, Clock clock) {
    return new MongoAgentConfigStore(
        mongoTemplate, properties.getStore().getConfigCollection(), clock);
  }

  @Bean
  public MongoConversationStore conversationStore(
      MongoTemplate mongoTemplate, GatewayProperties properties, Clock clock) {
    return new MongoConversationStore(
        mongoTemplate, properties.getStore().getConversationCollection(), clock);
  }

  /**
   * Index creation needs a reachable store; when it is not, startup continues and requests report
   * storage errors until it comes back.
   */
  @Bean
  public ApplicationRunner storeIndexInitializer(
      MongoAgentConfigStore agentConfigStore, MongoConversationStore conversationStore) {
    return args -> {
      try {
        agentConfigStore.ensureIndexes();
        conversationStore.ensureIndexes();
      } catch (StorageException ex) {
        log.warn("Could not create store indexes, continuing without them: {}", ex.getMessage());
      }
    };
  }
}
