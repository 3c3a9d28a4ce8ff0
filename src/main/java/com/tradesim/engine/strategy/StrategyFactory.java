package com.tradesim.engine.strategy;

import com.tradesim.config.Config;
import com.tradesim.engine.IndicatorSpec;

import java.util.List;
import java.util.Locale;

/**
 * Builds a fresh strategy instance per bot. Every strategy trades a step of
 * {@code stoploss x strategy.step.fraction} in quote terms.
 */
public class StrategyFactory {

    public static final List<String> STRATEGY_IDS = List.of(
            TrendFollowStrategy.ID, CrossoverStrategy.ID, ThresholdOscillatorStrategy.ID);

    public TradingStrategy create(String strategyId, double stoploss) {
        double stepSize = stoploss * Config.getDouble("strategy.step.fraction", 0.01);

        switch (strategyId.toLowerCase(Locale.ROOT)) {
            case TrendFollowStrategy.ID:
            case "naive_momentum":
                return new TrendFollowStrategy(stepSize,
                        Config.getInt("strategy.trend.lookback", 3),
                        Config.getInt("strategy.trend.cooldown", 3));
            case CrossoverStrategy.ID: {
                int fastPeriod = Config.getInt("strategy.crossover.fast", 9);
                int slowPeriod = Config.getInt("strategy.crossover.slow", 21);
                boolean simple = "sma".equalsIgnoreCase(Config.get("strategy.crossover.type", "ema"));
                return new CrossoverStrategy(stepSize,
                        simple ? IndicatorSpec.sma(fastPeriod) : IndicatorSpec.ema(fastPeriod),
                        simple ? IndicatorSpec.sma(slowPeriod) : IndicatorSpec.ema(slowPeriod));
            }
            case ThresholdOscillatorStrategy.ID:
                return new ThresholdOscillatorStrategy(stepSize,
                        IndicatorSpec.rsi(Config.getInt("strategy.oscillator.period", 14)),
                        Config.getDouble("strategy.oscillator.oversold", 30.0),
                        Config.getDouble("strategy.oscillator.overbought", 70.0),
                        Config.getInt("strategy.oscillator.cooldown", 3));
            default:
                throw new IllegalArgumentException("Unknown strategy: " + strategyId);
        }
    }
}
