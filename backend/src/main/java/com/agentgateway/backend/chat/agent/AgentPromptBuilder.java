package com.agentgateway.backend.chat.agent;

import com.agentgateway.backend.agent.domain.AgentOptions;
import com.agentgateway.backend.conversation.domain.ConversationTurn;
import com.agentgateway.backend.conversation.domain.TurnRole;
import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

/**
 * Lays out the provider transcript: the system prompt when configured, the stored history, then
 * the new user message. Runs of consecutive assistant turns are sent as one assistant message.
 */
public class AgentPromptBuilder {

  public List<Message> build(
      AgentOptions options, List<ConversationTurn> history, String userMessage) {
    List<Message> messages = new ArrayList<>(history.size() + 2);
    if (options.hasSystemPrompt()) {
      messages.add(new SystemMessage(options.systemPrompt()));
    }

    StringBuilder assistantRun = null;
    for (ConversationTurn turn : history) {
      if (turn.role() == TurnRole.ASSISTANT) {
        if (assistantRun == null) {
          assistantRun = new StringBuilder(turn.text());
        } else {
          assistantRun.append(' ').append(turn.text());
        }
        continue;
      }
      if (assistantRun != null) {
        messages.add(new AssistantMessage(assistantRun.toString()));
        assistantRun = null;
      }
      messages.add(new UserMessage(turn.text()));
    }
    if (assistantRun != null) {
      messages.add(new AssistantMessage(assistantRun.toString()));
    }

    messages.add(new UserMessage(userMessage));
    return messages;
  }
}
