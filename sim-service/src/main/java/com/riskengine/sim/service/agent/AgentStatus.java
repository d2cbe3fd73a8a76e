package com.riskengine.sim.service.agent;

public enum AgentStatus {
    UNINITIALIZED,
    INITIALIZING,
    ACTIVE
}
