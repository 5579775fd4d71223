package com.agentgateway.backend.agent.api;

import java.util.List;

public record ClientListResponse(List<String> clients) {}
