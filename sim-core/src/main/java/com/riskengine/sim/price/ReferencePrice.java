package com.riskengine.sim.price;

import java.time.Instant;

/**
 * One feed tick's view of a symbol.
 *
 * @param rawPrice      external price before any scenario
 * @param adjustedPrice price after the active scenario multiplier
 * @param priceE6       {@code adjustedPrice} in 1e6 fixed point, as pushed to the ledger
 */
public record ReferencePrice(
    String symbol,
    double rawPrice,
    double adjustedPrice,
    long priceE6,
    Instant observedAt
) {
}
