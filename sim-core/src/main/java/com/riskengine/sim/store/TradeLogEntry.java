package com.riskengine.sim.store;

/**
 * One executed trade as shown in the public trade feed.
 *
 * @param size absolute size in ledger base units
 * @param side {@code long} or {@code short}
 */
public record TradeLogEntry(
    String slabAddress,
    String trader,
    String side,
    long size,
    double price,
    double fee,
    String txSignature
) {
}
