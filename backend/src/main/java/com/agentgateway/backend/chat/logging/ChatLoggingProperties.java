package com.agentgateway.backend.chat.logging;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.gateway.logging")
public class ChatLoggingProperties {

  /**
   * Whether the transcript sent to the provider is logged at DEBUG.
   */
  private boolean promptEnabled = false;

  /**
   * Whether the completion text is logged too. Has no effect unless prompt logging is enabled.
   */
  private boolean logCompletion = false;

  public boolean isPromptEnabled() {
    return promptEnabled;
  }

  public void setPromptEnabled(boolean promptEnabled) {
    this.promptEnabled = promptEnabled;
  }

  public boolean isLogCompletion() {
    return logCompletion;
  }

  public void setLogCompletion(boolean logCompletion) {
    this.logCompletion = logCompletion;
  }
}
