package com.agentgateway.backend.conversation.persistence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/** All turns of one chat, kept in a single document so that appends are atomic. */
@Document
public class ConversationDocument {

  static final String CLIENT_ID = "clientId";
  static final String CONFIG_ID = "configId";
  static final String CHAT_ID = "chatId";
  static final String MESSAGES = "messages";
  static final String CREATED_AT = "createdAt";
  static final String UPDATED_AT = "updatedAt";

  @Id private String id;

  @Field("client_id")
  private String clientId;

  @Field("config_id")
  private String configId;

  @Field("chat_id")
  private String chatId;

  private List<TurnDocument> messages = new ArrayList<>();

  @Field("timestamp")
  private Instant createdAt;

  @Field("updated_at")
  private Instant updatedAt;

  protected ConversationDocument() {}

  public String getId() {
    return id;
  }

  public String getClientId() {
    return clientId;
  }

  public String getConfigId() {
    return configId;
  }

  public String getChatId() {
    return chatId;
  }

  public List<TurnDocument> getMessages() {
    return messages;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
