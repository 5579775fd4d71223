package com.agentgateway.backend.chat.session;

import com.agentgateway.backend.agent.domain.AgentConfig;
import com.agentgateway.backend.agent.domain.AgentOptions;
import com.agentgateway.backend.agent.persistence.AgentConfigStore;
import com.agentgateway.backend.chat.agent.ChatAgent;
import com.agentgateway.backend.common.exception.ConfigNotFoundException;
import com.agentgateway.backend.common.exception.GatewayException;
import com.agentgateway.backend.common.exception.StorageException;
import com.agentgateway.backend.conversation.domain.ConversationKey;
import com.agentgateway.backend.conversation.domain.ConversationTurn;
import com.agentgateway.backend.conversation.persistence.ConversationStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * State of one chat connection, independent of the socket that carries it.
 *
 * <p>{@code CONNECTED} until {@link #open()} has loaded the agent config, then it alternates
 * between {@code AWAITING_MESSAGE} and {@code PROCESSING} for every inbound message until the
 * connection goes away ({@code CLOSED}). A failed turn produces one error frame and leaves the
 * session waiting for the next message; neither turn of a failed round trip is stored.
 */
@Slf4j
public class GatewaySession {

  static final String CONFIG_NOT_FOUND_REASON = "No such bot config found";
  static final String CONFIG_UNAVAILABLE_REASON = "Bot config unavailable";

  private final ConversationKey key;
  private final FrameSink sink;
  private final AgentConfigStore configStore;
  private final ConversationStore conversationStore;
  private final ChatAgent chatAgent;
  private final ObjectMapper objectMapper;
  private final GatewayMetrics metrics;
  private final Clock clock;
  private final AtomicReference<SessionState> state =
      new AtomicReference<>(SessionState.CONNECTED);

  private AgentConfig config;

  GatewaySession(
      ConversationKey key,
      FrameSink sink,
      AgentConfigStore configStore,
      ConversationStore conversationStore,
      ChatAgent chatAgent,
      ObjectMapper objectMapper,
      GatewayMetrics metrics,
      Clock clock) {
    this.key = key;
    this.sink = sink;
    this.configStore = configStore;
    this.conversationStore = conversationStore;
    this.chatAgent = chatAgent;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  public ConversationKey key() {
    return key;
  }

  public SessionState state() {
    return state.get();
  }

  /**
   * Loads the agent config. When there is none the session sends an error frame and closes the
   * connection; otherwise it greets a fresh chat and starts waiting for messages.
   */
  public void open() {
    if (state.get() != SessionState.CONNECTED) {
      throw new IllegalStateException("Chat session " + key + " is already " + state.get());
    }
    try {
      config = configStore.get(key.clientId(), key.configId());
    } catch (ConfigNotFoundException ex) {
      reject(ex, CONFIG_NOT_FOUND_REASON);
      return;
    } catch (StorageException ex) {
      reject(ex, CONFIG_UNAVAILABLE_REASON);
      return;
    }
    if (!state.compareAndSet(SessionState.CONNECTED, SessionState.AWAITING_MESSAGE)) {
      return;
    }
    metrics.sessionOpened();
    log.info("Chat session {} opened for bot '{}'", key, config.botName());
    greet();
  }

  public void onMessage(String text) {
    if (!StringUtils.hasText(text)) {
      log.debug("Ignoring blank message on chat {}", key);
      return;
    }
    processTurn(() -> roundTrip(text));
  }

  public void onClose() {
    SessionState previous = state.getAndSet(SessionState.CLOSED);
    if (previous != SessionState.CLOSED) {
      log.info("Chat session {} closed in state {}", key, previous);
    }
  }

  private void greet() {
    AgentOptions options;
    try {
      options = config.agentOptions();
    } catch (IllegalArgumentException ex) {
      log.warn("Skipping greeting for chat {}: {}", key, ex.getMessage());
      return;
    }
    String userInitialMessage = options.userInitialMessage();
    String botInitialMessage = options.botInitialMessage();
    if (userInitialMessage == null && botInitialMessage == null) {
      return;
    }

    processTurn(
        () -> {
          if (!conversationStore.getHistory(key).isEmpty()) {
            return;
          }
          if (userInitialMessage != null) {
            roundTrip(userInitialMessage);
          }
          if (botInitialMessage != null) {
            conversationStore.appendTurns(
                key, List.of(ConversationTurn.assistant(botInitialMessage, clock.instant())));
            deliver(botInitialMessage);
          }
        });
  }

  private void processTurn(Runnable turn) {
    if (!state.compareAndSet(SessionState.AWAITING_MESSAGE, SessionState.PROCESSING)) {
      log.debug("Dropping frame for chat {} in state {}", key, state.get());
      return;
    }
    try {
      turn.run();
    } catch (GatewayException ex) {
      metrics.turnFailed(ex.getKind());
      log.warn("Turn failed for chat {} with {}: {}", key, ex.getKind(), ex.getMessage());
      sendError(ex);
    } finally {
      state.compareAndSet(SessionState.PROCESSING, SessionState.AWAITING_MESSAGE);
    }
  }

  private void roundTrip(String userMessage) {
    List<ConversationTurn> history = conversationStore.getHistory(key);
    ConversationTurn userTurn = ConversationTurn.user(userMessage, clock.instant());
    String reply = chatAgent.generateReply(config, history, userMessage);
    conversationStore.appendTurns(
        key, List.of(userTurn, ConversationTurn.assistant(reply, clock.instant())));
    metrics.turnCompleted();
    deliver(reply);
  }

  private void reject(GatewayException ex, String reason) {
    metrics.sessionRejected();
    log.info("Rejecting chat session {}: {}", key, ex.getMessage());
    sendError(ex);
    state.set(SessionState.CLOSED);
    try {
      sink.close(reason);
    } catch (IOException closeError) {
      log.warn("Failed to close chat connection {}", key, closeError);
    }
  }

  private void sendError(GatewayException ex) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(ErrorFrame.from(ex));
    } catch (JsonProcessingException serializationError) {
      throw new IllegalStateException("Failed to serialize error frame", serializationError);
    }
    deliver(payload);
  }

  private void deliver(String payload) {
    try {
      sink.sendText(payload);
    } catch (IOException ex) {
      log.warn("Failed to deliver frame on chat {}, closing session", key, ex);
      state.set(SessionState.CLOSED);
    }
  }
}
