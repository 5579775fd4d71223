package com.agentgateway.backend.common.exception;

public class ConfigNotFoundException extends GatewayException {

  private final String clientId;
  private final String configId;

  public ConfigNotFoundException(String clientId, String configId) {
    super(
        ErrorKind.CONFIG_NOT_FOUND,
        "No such bot config found: client '" + clientId + "', config '" + configId + "'");
    this.clientId = clientId;
    this.configId = configId;
  }

  public String getClientId() {
    return clientId;
  }

  public String getConfigId() {
    return configId;
  }
}
