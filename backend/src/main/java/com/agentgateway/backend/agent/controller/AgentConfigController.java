package com.agentgateway.backend.agent.controller;

import com.agentgateway.backend.agent.api.AddConfigRequest;
import com.agentgateway.backend.agent.api.AddConfigResponse;
import com.agentgateway.backend.agent.api.AgentConfigResponse;
import com.agentgateway.backend.agent.api.AgentConfigView;
import com.agentgateway.backend.agent.api.ClientListResponse;
import com.agentgateway.backend.agent.api.ConfigListResponse;
import com.agentgateway.backend.agent.api.ConfigLookupRequest;
import com.agentgateway.backend.agent.domain.AgentOptions;
import com.agentgateway.backend.agent.domain.UpsertOutcome;
import com.agentgateway.backend.agent.persistence.AgentConfigStore;
import com.agentgateway.backend.common.exception.RequestValidationException;
import jakarta.validation.Valid;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Administrative routes for the agent configuration catalogue. */
@Slf4j
@RestController
public class AgentConfigController {

  private final AgentConfigStore configStore;

  public AgentConfigController(AgentConfigStore configStore) {
    this.configStore = configStore;
  }

  @GetMapping("/client/list")
  public ClientListResponse listClients() {
    return new ClientListResponse(List.copyOf(configStore.listClients()));
  }

  @GetMapping("/list/{clientId}")
  public ConfigListResponse listConfigs(@PathVariable("clientId") String clientId) {
    return new ConfigListResponse(clientId, configStore.listConfigs(clientId));
  }

  @PostMapping("/add_config")
  public AddConfigResponse addConfig(@Valid @RequestBody AddConfigRequest request) {
    try {
      AgentOptions.from(request.config());
    } catch (IllegalArgumentException ex) {
      throw new RequestValidationException("config: " + ex.getMessage(), ex);
    }
    UpsertOutcome outcome =
        configStore.upsert(
            request.clientId(), request.configId(), request.botName(), request.config());
    log.info(
        "Config {}/{} {}",
        request.clientId(),
        request.configId(),
        outcome == UpsertOutcome.INSERTED ? "inserted" : "updated");
    return AddConfigResponse.of(outcome);
  }

  @GetMapping("/get_config")
  public AgentConfigResponse getConfig(
      @RequestParam("client_id") String clientId, @RequestParam("config_id") String configId) {
    requireText("client_id", clientId);
    requireText("config_id", configId);
    return lookup(clientId, configId);
  }

  @PostMapping("/get_config")
  public AgentConfigResponse getConfig(@Valid @RequestBody ConfigLookupRequest request) {
    return lookup(request.clientId(), request.configId());
  }

  private AgentConfigResponse lookup(String clientId, String configId) {
    return new AgentConfigResponse(AgentConfigView.from(configStore.get(clientId, configId)));
  }

  private static void requireText(String name, String value) {
    if (!StringUtils.hasText(value)) {
      throw new RequestValidationException(name + ": must not be blank");
    }
  }
}
