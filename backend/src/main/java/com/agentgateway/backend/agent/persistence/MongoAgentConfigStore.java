package com.agentgateway.backend.agent.persistence;

import com.agentgateway.backend.agent.domain.AgentConfig;
import com.agentgateway.backend.agent.domain.UpsertOutcome;
import com.agentgateway.backend.common.exception.StorageException;
import com.mongodb.client.result.UpdateResult;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

public class MongoAgentConfigStore implements AgentConfigStore {

  private static final Logger log = LoggerFactory.getLogger(MongoAgentConfigStore.class);

  private final MongoOperations mongoOperations;
  private final String collection;
  private final Clock clock;

  public MongoAgentConfigStore(MongoOperations mongoOperations, String collection, Clock clock) {
    this.mongoOperations = mongoOperations;
    this.collection = collection;
    this.clock = clock;
  }

  /** Declares the unique {@code (client_id, config_id)} key on the config collection. */
  public void ensureIndexes() {
    try {
      mongoOperations
          .indexOps(collection)
          .ensureIndex(
              new Index()
                  .on("client_id", Sort.Direction.ASC)
                  .on("config_id", Sort.Direction.ASC)
                  .unique()
                  .named("client_config_unique"));
    } catch (DataAccessException ex) {
      throw new StorageException("Failed to create indexes on '" + collection + "'", ex);
    }
  }

  @Override
  public UpsertOutcome upsert(
      String clientId, String configId, String botName, Map<String, Object> options) {
    Instant now = clock.instant();
    Update update =
        new Update()
            .set(AgentConfigDocument.AGENT_CONFIG, options)
            .set(
                AgentConfigDocument.BOT_NAME,
                botName != null && !botName.isBlank() ? botName : AgentConfig.DEFAULT_BOT_NAME)
            .set(AgentConfigDocument.UPDATED_AT, now)
            .setOnInsert(AgentConfigDocument.CREATED_AT, now);
    try {
      UpdateResult result =
          mongoOperations.upsert(
              byKey(clientId, configId), update, AgentConfigDocument.class, collection);
      UpsertOutcome outcome =
          result.getUpsertedId() != null ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
      log.debug("Config {}/{} {}", clientId, configId, outcome);
      return outcome;
    } catch (DataAccessException ex) {
      throw new StorageException(
          "Failed to store config '" + configId + "' for client '" + clientId + "'", ex);
    }
  }

  @Override
  public Optional<AgentConfig> find(String clientId, String configId) {
    try {
      return Optional.ofNullable(
              mongoOperations.findOne(
                  byKey(clientId, configId), AgentConfigDocument.class, collection))
          .map(AgentConfigDocument::toDomain);
    } catch (DataAccessException ex) {
      throw new StorageException(
          "Failed to load config '" + configId + "' for client '" + clientId + "'", ex);
    }
  }

  @Override
  public SortedSet<String> listClients() {
    try {
      return new TreeSet<>(
          mongoOperations.findDistinct(
              new Query(),
              AgentConfigDocument.CLIENT_ID,
              collection,
              AgentConfigDocument.class,
              String.class));
    } catch (DataAccessException ex) {
      throw new StorageException("Failed to list clients", ex);
    }
  }

  @Override
  public List<String> listConfigs(String clientId) {
    Query query =
        Query.query(Criteria.where(AgentConfigDocument.CLIENT_ID).is(clientId))
            .with(Sort.by(Sort.Direction.ASC, AgentConfigDocument.CONFIG_ID));
    query.fields().include(AgentConfigDocument.CONFIG_ID);
    try {
      return mongoOperations.find(query, AgentConfigDocument.class, collection).stream()
          .map(AgentConfigDocument::getConfigId)
          .toList();
    } catch (DataAccessException ex) {
      throw new StorageException("Failed to list configs for client '" + clientId + "'", ex);
    }
  }

  private Query byKey(String clientId, String configId) {
    return Query.query(
        Criteria.where(AgentConfigDocument.CLIENT_ID)
            .is(clientId)
            .and(AgentConfigDocument.CONFIG_ID)
            .is(configId));
  }
}
