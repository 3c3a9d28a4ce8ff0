package com.tradesim.engine.strategy;

import com.tradesim.engine.IndicatorSpec;
import com.tradesim.model.BotContext;
import com.tradesim.model.Decision;
import com.tradesim.model.IndicatorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Moving Average Crossover
 *
 * Buys when the fast average crosses above the slow one and sells when it crosses
 * below. The crossing edge is detected against the previous cycle's values, so a
 * cross produces exactly one signal no matter how long the averages stay apart.
 */
public class CrossoverStrategy implements TradingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(CrossoverStrategy.class);

    public static final String ID = "ma_crossover";

    private final double stepSize;
    private final IndicatorSpec fast;
    private final IndicatorSpec slow;

    private Double previousFast;
    private Double previousSlow;

    public CrossoverStrategy(double stepSize, IndicatorSpec fast, IndicatorSpec slow) {
        if (fast.warmupLength() >= slow.warmupLength()) {
            throw new IllegalArgumentException("Fast average " + fast + " must be shorter than slow " + slow);
        }
        this.stepSize = stepSize;
        this.fast = fast;
        this.slow = slow;
        logger.info("✅ Crossover strategy initialized: fast={}, slow={}, step=${}", fast, slow, stepSize);
    }

    @Override
    public Decision decide(BotContext context) {
        IndicatorSnapshot indicators = context.getIndicators();
        OptionalDouble fastValue = indicators.value(fast.id());
        OptionalDouble slowValue = indicators.value(slow.id());

        if (fastValue.isEmpty() || slowValue.isEmpty()) {
            logger.debug("⏸️ {} crossover waiting for warm-up ({} / {})", context.getPair(), fast, slow);
            return Decision.hold();
        }

        double currentFast = fastValue.getAsDouble();
        double currentSlow = slowValue.getAsDouble();
        Decision decision = Decision.hold();

        if (previousFast != null && previousSlow != null) {
            boolean wasAtOrBelow = previousFast <= previousSlow;
            boolean wasAtOrAbove = previousFast >= previousSlow;
            if (wasAtOrBelow && currentFast > currentSlow) {
                logger.info("📈 {} bullish cross: {} {} > {} {}", context.getPair(), fast,
                        String.format("%.2f", currentFast), slow, String.format("%.2f", currentSlow));
                decision = Decision.buy(stepSize);
            } else if (wasAtOrAbove && currentFast < currentSlow) {
                logger.info("📉 {} bearish cross: {} {} < {} {}", context.getPair(), fast,
                        String.format("%.2f", currentFast), slow, String.format("%.2f", currentSlow));
                decision = Decision.sell(stepSize);
            }
        }

        previousFast = currentFast;
        previousSlow = currentSlow;
        return decision;
    }

    @Override
    public Set<IndicatorSpec> requiredIndicators() {
        return Set.of(fast, slow);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "MA Crossover Bot (" + fast + "/" + slow + ")";
    }
}
