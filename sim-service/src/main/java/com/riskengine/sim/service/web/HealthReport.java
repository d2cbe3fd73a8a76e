package com.riskengine.sim.service.web;

import java.util.Map;

/**
 * @param uptime    seconds since the service started
 * @param timestamp ISO-8601 instant of the report
 */
public record HealthReport(
        String status,
        long uptime,
        Feed feed,
        Agents agents,
        String timestamp
) {

    /**
     * @param lastPrices adjusted price per symbol
     */
    public record Feed(boolean running, Map<String, Double> lastPrices) {
    }

    public record Agents(boolean running, int count) {
    }
}
