package com.riskengine.sim.price;

import java.io.IOException;
import java.util.Map;

/**
 * External source of real market prices.
 */
public interface ReferencePriceSource {

  /**
   * Latest price per symbol. Symbols the source has no price for are absent from the result.
   *
   * @throws IOException when the source cannot be reached or answers with an error
   */
  Map<String, Double> fetchLatest() throws IOException;
}
