package com.riskengine.sim.service.feed;

import com.riskengine.sim.config.SimProperties;

import java.io.IOException;

/**
 * Writes a reference price to a market and advances its state.
 */
public interface OracleGateway {

    /**
     * @return signature of the crank transaction
     */
    String pushAndCrank(SimProperties.Market market, long priceE6) throws IOException;
}
