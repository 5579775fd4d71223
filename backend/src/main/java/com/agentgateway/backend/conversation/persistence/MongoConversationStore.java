package com.agentgateway.backend.conversation.persistence;

import com.agentgateway.backend.common.exception.StorageException;
import com.agentgateway.backend.conversation.domain.ConversationKey;
import com.agentgateway.backend.conversation.domain.ConversationTurn;
import com.agentgateway.backend.conversation.domain.TurnRole;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

public class MongoConversationStore implements ConversationStore {

  private static final Logger log = LoggerFactory.getLogger(MongoConversationStore.class);

  private final MongoOperations mongoOperations;
  private final String collection;
  private final Clock clock;

  public MongoConversationStore(MongoOperations mongoOperations, String collection, Clock clock) {
    this.mongoOperations = mongoOperations;
    this.collection = collection;
    this.clock = clock;
  }

  public void ensureIndexes() {
    try {
      mongoOperations
          .indexOps(collection)
          .ensureIndex(
              new Index()
                  .on("client_id", Sort.Direction.ASC)
                  .on("config_id", Sort.Direction.ASC)
                  .on("chat_id", Sort.Direction.ASC)
                  .unique()
                  .named("client_config_chat_unique"));
    } catch (DataAccessException ex) {
      throw new StorageException("Failed to create indexes on '" + collection + "'", ex);
    }
  }

  @Override
  public void appendTurns(ConversationKey key, List<ConversationTurn> turns) {
    if (turns.isEmpty()) {
      return;
    }
    Instant now = clock.instant();
    Update update =
        new Update()
            .push(ConversationDocument.MESSAGES)
            .each(turns.stream().map(TurnDocument::from).toArray())
            .set(ConversationDocument.UPDATED_AT, now)
            .setOnInsert(ConversationDocument.CREATED_AT, now);
    try {
      mongoOperations.upsert(byKey(key), update, ConversationDocument.class, collection);
      log.debug("Appended {} turn(s) to chat {}", turns.size(), key);
    } catch (DataAccessException ex) {
      throw new StorageException("Failed to append turns to chat '" + key + "'", ex);
    }
  }

  @Override
  public void appendTurn(ConversationKey key, TurnRole role, String text) {
    appendTurns(key, List.of(new ConversationTurn(role, text, clock.instant())));
  }

  @Override
  public List<ConversationTurn> getHistory(ConversationKey key) {
    ConversationDocument document;
    try {
      document = mongoOperations.findOne(byKey(key), ConversationDocument.class, collection);
    } catch (DataAccessException ex) {
      throw new StorageException("Failed to load history of chat '" + key + "'", ex);
    }
    if (document == null || document.getMessages() == null) {
      return List.of();
    }
    return document.getMessages().stream().map(TurnDocument::toDomain).toList();
  }

  private Query byKey(ConversationKey key) {
    return Query.query(
        Criteria.where(ConversationDocument.CLIENT_ID)
            .is(key.clientId())
            .and(ConversationDocument.CONFIG_ID)
            .is(key.configId())
            .and(ConversationDocument.CHAT_ID)
            .is(key.chatId()));
  }
}
