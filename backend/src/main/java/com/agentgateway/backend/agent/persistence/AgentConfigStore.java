package com.agentgateway.backend.agent.persistence;

import com.agentgateway.backend.agent.domain.AgentConfig;
import com.agentgateway.backend.agent.domain.UpsertOutcome;
import com.agentgateway.backend.common.exception.ConfigNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Access to agent configurations keyed by {@code (clientId, configId)}. Implementations report an
 * unreachable or failing store with {@link com.agentgateway.backend.common.exception.StorageException}.
 */
public interface AgentConfigStore {

  /** Writes the record, replacing the whole option mapping of an existing one. */
  UpsertOutcome upsert(String clientId, String configId, String botName, Map<String, Object> options);

  Optional<AgentConfig> find(String clientId, String configId);

  default AgentConfig get(String clientId, String configId) {
    return find(clientId, configId)
        .orElseThrow(() -> new ConfigNotFoundException(clientId, configId));
  }

  SortedSet<String> listClients();

  /** Config ids of one client in ascending order; empty for an unknown client. */
  List<String> listConfigs(String clientId);
}
