package com.agentgateway.backend.chat.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.agentgateway.backend.conversation.domain.ConversationKey;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

class ChatPathHandshakeInterceptorTest {

  private final ChatPathHandshakeInterceptor interceptor = new ChatPathHandshakeInterceptor();

  @Test
  void resolvesConversationKeyFromPath() {
    Map<String, Object> attributes = new HashMap<>();
    MockHttpServletResponse servletResponse = new MockHttpServletResponse();

    boolean accepted =
        interceptor.beforeHandshake(
            request("/chat/acme/support/chat-42"),
            new ServletServerHttpResponse(servletResponse),
            mock(WebSocketHandler.class),
            attributes);

    assertThat(accepted).isTrue();
    assertThat(attributes.get(ChatPathHandshakeInterceptor.CONVERSATION_KEY_ATTRIBUTE))
        .isEqualTo(new ConversationKey("acme", "support", "chat-42"));
  }

  @Test
  void decodesSegmentsAndIgnoresContextPath() {
    assertThat(ChatPathHandshakeInterceptor.resolveKey("/api/v1/chat/acme%20corp/support/42"))
        .isEqualTo(new ConversationKey("acme corp", "support", "42"));
  }

  @Test
  void refusesPathsWithoutThreeIdentifiers() {
    Map<String, Object> attributes = new HashMap<>();
    MockHttpServletResponse servletResponse = new MockHttpServletResponse();

    boolean accepted =
        interceptor.beforeHandshake(
            request("/chat/acme/support"),
            new ServletServerHttpResponse(servletResponse),
            mock(WebSocketHandler.class),
            attributes);

    assertThat(accepted).isFalse();
    assertThat(servletResponse.getStatus()).isEqualTo(400);
    assertThat(attributes).isEmpty();
  }

  @Test
  void refusesBlankIdentifiers() {
    assertThat(ChatPathHandshakeInterceptor.resolveKey("/chat/acme/%20/42")).isNull();
    assertThat(ChatPathHandshakeInterceptor.resolveKey("/talk/acme/support/42")).isNull();
  }

  private static ServletServerHttpRequest request(String path) {
    MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", path);
    return new ServletServerHttpRequest(servletRequest);
  }
}
