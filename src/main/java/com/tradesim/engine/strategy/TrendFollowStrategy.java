package com.tradesim.engine.strategy;

import com.tradesim.model.BotContext;
import com.tradesim.model.Decision;
import com.tradesim.model.TradeSide;
import com.tradesim.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Trend Following (naive momentum)
 *
 * Records the price seen at every cycle. Buys one step after {@code lookback}
 * strictly rising prices, sells one step after {@code lookback} strictly falling
 * prices, then sits out {@code cooldown} cycles before reacting again.
 */
public class TrendFollowStrategy implements TradingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(TrendFollowStrategy.class);

    public static final String ID = "trend_follow";

    private final double stepSize;
    private final int lookback;
    private final int cooldown;

    // Internal state (tracked across cycles)
    private final PriceHistory priceHistory;
    private int cooldownRemaining = 0;
    private int totalBuys = 0;
    private int totalSells = 0;
    private String lastAction = "initialized";

    public TrendFollowStrategy(double stepSize, int lookback, int cooldown) {
        if (lookback < 2) {
            throw new IllegalArgumentException("Trend lookback needs at least 2 samples");
        }
        this.stepSize = stepSize;
        this.lookback = lookback;
        this.cooldown = cooldown;
        this.priceHistory = new PriceHistory(Math.max(10, lookback));
        logger.info("✅ Trend follow strategy initialized: lookback={}, cooldown={}, step=${}", lookback, cooldown,
                stepSize);
    }

    @Override
    public Decision decide(BotContext context) {
        priceHistory.push(context.getCurrentPrice());

        if (cooldownRemaining > 0) {
            cooldownRemaining--;
            lastAction = "cooldown (" + cooldownRemaining + ")";
            return Decision.hold();
        }

        if (!priceHistory.hasAtLeast(lookback)) {
            lastAction = "warming up";
            return Decision.hold();
        }

        List<Double> recent = priceHistory.lastN(lookback);
        if (isMonotonic(recent, true)) {
            cooldownRemaining = cooldown;
            lastAction = String.format("buy $%.2f", stepSize);
            return Decision.buy(stepSize);
        }
        if (isMonotonic(recent, false)) {
            cooldownRemaining = cooldown;
            lastAction = String.format("sell $%.2f", stepSize);
            return Decision.sell(stepSize);
        }

        lastAction = "no trend";
        logger.debug("No trend in {}", recent);
        return Decision.hold();
    }

    private boolean isMonotonic(List<Double> prices, boolean rising) {
        for (int i = 1; i < prices.size(); i++) {
            double prev = prices.get(i - 1);
            double curr = prices.get(i);
            if (rising ? curr <= prev : curr >= prev) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void onTradeExecuted(Decision decision, Transaction transaction) {
        if (transaction.getSide() == TradeSide.BUY) {
            totalBuys++;
        } else {
            totalSells++;
        }
    }

    public int getCooldownRemaining() {
        return cooldownRemaining;
    }

    public int getTotalBuys() {
        return totalBuys;
    }

    public int getTotalSells() {
        return totalSells;
    }

    public String getLastAction() {
        return lastAction;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Trend Follow Bot";
    }
}
