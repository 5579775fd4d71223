package com.agentgateway.backend.chat.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.agentgateway.backend.agent.domain.AgentConfig;
import com.agentgateway.backend.common.exception.StorageException;
import com.agentgateway.backend.conversation.domain.ConversationKey;
import com.agentgateway.backend.conversation.domain.ConversationTurn;
import com.agentgateway.backend.conversation.domain.TurnRole;
import com.agentgateway.backend.support.InMemoryAgentConfigStore;
import com.agentgateway.backend.support.InMemoryConversationStore;
import com.agentgateway.backend.support.RecordingFrameSink;
import com.agentgateway.backend.support.StubChatAgent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GatewaySessionTest {

  private static final ConversationKey KEY = new ConversationKey("acme", "support", "chat-1");

  private final ObjectMapper objectMapper = new ObjectMapper();

  private InMemoryAgentConfigStore configStore;
  private InMemoryConversationStore conversationStore;
  private StubChatAgent chatAgent;
  private SimpleMeterRegistry meterRegistry;
  private GatewaySessionFactory sessionFactory;

  @BeforeEach
  void setUp() {
    configStore = new InMemoryAgentConfigStore();
    conversationStore = new InMemoryConversationStore();
    chatAgent = new StubChatAgent();
    meterRegistry = new SimpleMeterRegistry();
    sessionFactory =
        new GatewaySessionFactory(
            configStore,
            conversationStore,
            chatAgent,
            objectMapper,
            new GatewayMetrics(meterRegistry),
            Clock.systemUTC());
  }

  @AfterEach
  void tearDown() {
    meterRegistry.close();
  }

  @Test
  void unknownConfigSendsErrorFrameAndCloses() throws Exception {
    RecordingFrameSink sink = new RecordingFrameSink();
    GatewaySession session = sessionFactory.create(KEY, sink);

    session.open();

    assertThat(sink.frames()).hasSize(1);
    JsonNode frame = objectMapper.readTree(sink.frames().get(0));
    assertThat(frame.get("error").asText()).isEqualTo("CONFIG_NOT_FOUND");
    assertThat(frame.get("message").asText()).contains("acme").contains("support");
    assertThat(sink.isClosed()).isTrue();
    assertThat(sink.closeReason()).isEqualTo(GatewaySession.CONFIG_NOT_FOUND_REASON);
    assertThat(session.state()).isEqualTo(SessionState.CLOSED);
    assertThat(conversationStore.getHistory(KEY)).isEmpty();
    assertThat(meterRegistry.counter("gateway_sessions", "outcome", "rejected").count())
        .isEqualTo(1.0);

    session.onMessage("hello?");
    assertThat(sink.frames()).hasSize(1);
    assertThat(chatAgent.receivedMessages()).isEmpty();
  }

  @Test
  void storeFailureAtConnectReportsStorageError() throws Exception {
    RecordingFrameSink sink = new RecordingFrameSink();
    InMemoryAgentConfigStore failingStore =
        new InMemoryAgentConfigStore() {
          @Override
          public Optional<AgentConfig> find(String clientId, String configId) {
            throw new StorageException("Store unavailable", null);
          }
        };
    GatewaySession session =
        new GatewaySessionFactory(
                failingStore,
                conversationStore,
                chatAgent,
                objectMapper,
                new GatewayMetrics(meterRegistry),
                Clock.systemUTC())
            .create(KEY, sink);

    session.open();

    assertThat(sink.frames()).hasSize(1);
    assertThat(objectMapper.readTree(sink.frames().get(0)).get("error").asText())
        .isEqualTo("STORAGE_ERROR");
    assertThat(sink.closeReason()).isEqualTo(GatewaySession.CONFIG_UNAVAILABLE_REASON);
    assertThat(session.state()).isEqualTo(SessionState.CLOSED);
  }

  @Test
  void messagesAreAnsweredAndStoredInArrivalOrder() {
    configStore.upsert("acme", "support", "Helper", Map.of("model", "gpt-4o-mini"));
    RecordingFrameSink sink = new RecordingFrameSink();
    GatewaySession session = sessionFactory.create(KEY, sink);

    session.open();
    assertThat(session.state()).isEqualTo(SessionState.AWAITING_MESSAGE);

    session.onMessage("first");
    session.onMessage("second");

    assertThat(sink.frames()).containsExactly("echo: first", "echo: second");
    assertThat(sink.isClosed()).isFalse();
    List<ConversationTurn> history = conversationStore.getHistory(KEY);
    assertThat(history)
        .extracting(ConversationTurn::role)
        .containsExactly(TurnRole.USER, TurnRole.ASSISTANT, TurnRole.USER, TurnRole.ASSISTANT);
    assertThat(history)
        .extracting(ConversationTurn::text)
        .containsExactly("first", "echo: first", "second", "echo: second");
    assertThat(meterRegistry.counter("gateway_turns", "outcome", "success").count())
        .isEqualTo(2.0);
  }

  @Test
  void providerFailureSendsOneErrorFrameAndKeepsSessionOpen() throws Exception {
    configStore.upsert("acme", "support", "Helper", Map.of());
    RecordingFrameSink sink = new RecordingFrameSink();
    GatewaySession session = sessionFactory.create(KEY, sink);
    session.open();

    chatAgent.failWith("Provider quota exceeded");
    session.onMessage("hello");

    assertThat(sink.frames()).hasSize(1);
    JsonNode frame = objectMapper.readTree(sink.frames().get(0));
    assertThat(frame.get("error").asText()).isEqualTo("PROVIDER_ERROR");
    assertThat(frame.get("message").asText()).isEqualTo("Provider quota exceeded");
    assertThat(conversationStore.getHistory(KEY)).isEmpty();
    assertThat(sink.isClosed()).isFalse();
    assertThat(session.state()).isEqualTo(SessionState.AWAITING_MESSAGE);
    assertThat(meterRegistry.counter("gateway_turns", "outcome", "provider_error").count())
        .isEqualTo(1.0);

    chatAgent.recover();
    session.onMessage("again");

    assertThat(sink.frames()).hasSize(2);
    assertThat(sink.frames().get(1)).isEqualTo("echo: again");
    assertThat(conversationStore.getHistory(KEY))
        .extracting(ConversationTurn::text)
        .containsExactly("again", "echo: again");
  }

  @Test
  void storageFailureDuringTurnReportsStorageError() throws Exception {
    configStore.upsert("acme", "support", "Helper", Map.of());
    RecordingFrameSink sink = new RecordingFrameSink();
    GatewaySession session = sessionFactory.create(KEY, sink);
    session.open();

    conversationStore.setFailing(true);
    session.onMessage("hello");

    assertThat(sink.frames()).hasSize(1);
    assertThat(objectMapper.readTree(sink.frames().get(0)).get("error").asText())
        .isEqualTo("STORAGE_ERROR");
    assertThat(session.state()).isEqualTo(SessionState.AWAITING_MESSAGE);
  }

  @Test
  void blankMessagesAndFramesAfterCloseAreIgnored() {
    configStore.upsert("acme", "support", "Helper", Map.of());
    RecordingFrameSink sink = new RecordingFrameSink();
    GatewaySession session = sessionFactory.create(KEY, sink);
    session.open();

    session.onMessage("   ");
    session.onMessage("");
    session.onClose();
    session.onMessage("too late");

    assertThat(session.state()).isEqualTo(SessionState.CLOSED);
    assertThat(sink.frames()).isEmpty();
    assertThat(chatAgent.receivedMessages()).isEmpty();
    assertThat(conversationStore.getHistory(KEY)).isEmpty();
  }

  @Test
  void greetingRunsOnFreshChatOnly() {
    configStore.upsert(
        "acme",
        "support",
        "Helper",
        Map.of("user_initial_message", "Hi there", "bot_initial_message", "How can I help?"));

    RecordingFrameSink firstSink = new RecordingFrameSink();
    sessionFactory.create(KEY, firstSink).open();

    assertThat(firstSink.frames()).containsExactly("echo: Hi there", "How can I help?");
    assertThat(conversationStore.getHistory(KEY))
        .extracting(ConversationTurn::role)
        .containsExactly(TurnRole.USER, TurnRole.ASSISTANT, TurnRole.ASSISTANT);

    RecordingFrameSink secondSink = new RecordingFrameSink();
    sessionFactory.create(KEY, secondSink).open();

    assertThat(secondSink.frames()).isEmpty();
    assertThat(conversationStore.getHistory(KEY)).hasSize(3);
  }

  @Test
  void concurrentSessionsOnDifferentChatsKeepIndependentHistories() throws Exception {
    configStore.upsert("acme", "support", "Helper", Map.of());
    ConversationKey firstKey = new ConversationKey("acme", "support", "chat-a");
    ConversationKey secondKey = new ConversationKey("acme", "support", "chat-b");
    int messages = 25;

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      List<Callable<Void>> tasks = new ArrayList<>();
      for (ConversationKey key : List.of(firstKey, secondKey)) {
        tasks.add(
            () -> {
              GatewaySession session = sessionFactory.create(key, new RecordingFrameSink());
              session.open();
              for (int i = 0; i < messages; i++) {
                session.onMessage(key.chatId() + "-" + i);
              }
              session.onClose();
              return null;
            });
      }
      for (Future<Void> future : executor.invokeAll(tasks)) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    for (ConversationKey key : List.of(firstKey, secondKey)) {
      List<String> expected =
          IntStream.range(0, messages)
              .boxed()
              .map(i -> key.chatId() + "-" + i)
              .flatMap(text -> Stream.of(text, "echo: " + text))
              .toList();
      assertThat(conversationStore.getHistory(key))
          .extracting(ConversationTurn::text)
          .containsExactlyElementsOf(expected);
    }
  }
}
