package com.tradesim.market;

import com.tradesim.model.PricePoint;

import java.io.IOException;

/**
 * Where live samples come from (an exchange ticker, a replay file, a simulator).
 */
public interface PriceSource {

    /**
     * Fetch the current price of an asset in the reference currency.
     *
     * @throws IOException when the upstream cannot be reached; the caller keeps polling
     */
    PricePoint fetch(String asset) throws IOException;

    /**
     * Human-readable name used in logs
     */
    String getName();
}
