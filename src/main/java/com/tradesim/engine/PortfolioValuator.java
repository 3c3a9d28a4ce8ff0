package com.tradesim.engine;

import com.tradesim.market.MarketDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Values whole accounts in the reference currency using the latest known prices.
 */
public class PortfolioValuator {
    private static final Logger logger = LoggerFactory.getLogger(PortfolioValuator.class);

    private final MarketDataStore marketData;

    public PortfolioValuator(MarketDataStore marketData) {
        this.marketData = marketData;
    }

    /**
     * Sum of every positive balance converted at its latest price. Assets with no
     * known price are left out and logged.
     */
    public double totalValue(Map<String, Double> balances) {
        double total = 0.0;
        for (Map.Entry<String, Double> entry : balances.entrySet()) {
            double balance = entry.getValue();
            if (balance <= 0.0) {
                continue;
            }
            OptionalDouble price = marketData.latestPrice(entry.getKey());
            if (price.isPresent()) {
                total += balance * price.getAsDouble();
            } else {
                logger.warn("Could not get price for {} when calculating portfolio value", entry.getKey());
            }
        }
        return total;
    }

    /**
     * Latest reference-currency price of an asset, or null when unknown. Used for the
     * execution-time snapshots stored on transactions.
     */
    public Double usdPrice(String asset) {
        OptionalDouble price = marketData.latestPrice(asset);
        return price.isPresent() ? price.getAsDouble() : null;
    }
}
