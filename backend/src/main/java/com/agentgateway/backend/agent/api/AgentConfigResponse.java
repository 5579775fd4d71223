package com.agentgateway.backend.agent.api;

public record AgentConfigResponse(AgentConfigView config) {}
