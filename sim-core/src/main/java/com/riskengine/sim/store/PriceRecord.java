package com.riskengine.sim.store;

/**
 * One pushed price, as persisted to {@code sim_price_history}.
 *
 * @param scenarioType wire id of the scenario active at push time, null when none
 * @param timestamp    epoch millis
 */
public record PriceRecord(
    String slabAddress,
    String symbol,
    long priceE6,
    long rawPriceE6,
    String scenarioType,
    long timestamp
) {
}
