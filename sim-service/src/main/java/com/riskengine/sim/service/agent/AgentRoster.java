package com.riskengine.sim.service.agent;

import java.util.List;

/**
 * The fleet, in scheduling order.
 */
public record AgentRoster(List<Agent> agents) {

    public AgentRoster {
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    public int size() {
        return agents.size();
    }
}
