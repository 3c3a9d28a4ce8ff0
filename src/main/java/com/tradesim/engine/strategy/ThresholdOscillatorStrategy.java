package com.tradesim.engine.strategy;

import com.tradesim.engine.IndicatorSpec;
import com.tradesim.model.BotContext;
import com.tradesim.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * RSI Threshold
 *
 * LONG: oscillator below the oversold level
 * SHORT: oscillator above the overbought level
 * After each signal the strategy holds for {@code cooldown} cycles.
 */
public class ThresholdOscillatorStrategy implements TradingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(ThresholdOscillatorStrategy.class);

    public static final String ID = "rsi_threshold";

    private final double stepSize;
    private final IndicatorSpec oscillator;
    private final double oversold;
    private final double overbought;
    private final int cooldown;

    private int cooldownRemaining = 0;

    public ThresholdOscillatorStrategy(double stepSize, IndicatorSpec oscillator, double oversold, double overbought,
            int cooldown) {
        if (oversold >= overbought) {
            throw new IllegalArgumentException("Oversold level must be below overbought level");
        }
        this.stepSize = stepSize;
        this.oscillator = oscillator;
        this.oversold = oversold;
        this.overbought = overbought;
        this.cooldown = cooldown;
        logger.info("✅ Threshold strategy initialized: {} [{}/{}], cooldown={}", oscillator, oversold, overbought,
                cooldown);
    }

    @Override
    public Decision decide(BotContext context) {
        if (cooldownRemaining > 0) {
            cooldownRemaining--;
            return Decision.hold();
        }

        OptionalDouble value = context.getIndicators().value(oscillator.id());
        if (value.isEmpty()) {
            logger.debug("⏸️ {} {} not available yet", context.getPair(), oscillator);
            return Decision.hold();
        }

        double current = value.getAsDouble();
        if (current < oversold) {
            cooldownRemaining = cooldown;
            logger.info("✅ {} oversold: {} {} < {}", context.getPair(), oscillator,
                    String.format("%.1f", current), oversold);
            return Decision.buy(stepSize);
        }
        if (current > overbought) {
            cooldownRemaining = cooldown;
            logger.info("✅ {} overbought: {} {} > {}", context.getPair(), oscillator,
                    String.format("%.1f", current), overbought);
            return Decision.sell(stepSize);
        }
        return Decision.hold();
    }

    @Override
    public Set<IndicatorSpec> requiredIndicators() {
        return Set.of(oscillator);
    }

    public int getCooldownRemaining() {
        return cooldownRemaining;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "RSI Threshold Bot (" + oscillator + ")";
    }
}
