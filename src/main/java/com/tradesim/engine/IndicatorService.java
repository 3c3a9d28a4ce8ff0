package com.tradesim.engine;

import com.tradesim.model.IndicatorSnapshot;
import com.tradesim.model.PricePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless indicator computation. Every call rebuilds a close-only bar series
 * from the prices it is given, so results never depend on earlier calls.
 */
public class IndicatorService {
    private static final Logger logger = LoggerFactory.getLogger(IndicatorService.class);

    // Bars only need strictly increasing end times; real timestamps are not required
    private static final ZonedDateTime SERIES_ORIGIN = ZonedDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC);
    private static final Duration BAR_PERIOD = Duration.ofMinutes(1);

    /**
     * Latest value of each requested indicator; indicators still warming up are left out.
     */
    public IndicatorSnapshot compute(List<Double> prices, Collection<IndicatorSpec> requested) {
        Map<String, Double> results = new LinkedHashMap<>();
        if (requested.isEmpty() || prices.isEmpty()) {
            return new IndicatorSnapshot(results);
        }

        BarSeries series = createBarSeries("snapshot", prices);
        ClosePriceIndicator closePrice = new ClosePriceIndicator(series);
        int endIndex = series.getEndIndex();

        for (IndicatorSpec spec : requested) {
            if (prices.size() < spec.warmupLength()) {
                continue;
            }
            double value = build(spec, closePrice).getValue(endIndex).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                logger.debug("Indicator {} produced {} over {} prices, reporting absent", spec, value, prices.size());
                continue;
            }
            results.put(spec.id(), value);
        }
        return new IndicatorSnapshot(results);
    }

    public IndicatorSnapshot computeFromPoints(List<PricePoint> points, Collection<IndicatorSpec> requested) {
        List<Double> prices = new ArrayList<>(points.size());
        for (PricePoint point : points) {
            prices.add(point.getPrice());
        }
        return compute(prices, requested);
    }

    private Indicator<Num> build(IndicatorSpec spec, ClosePriceIndicator closePrice) {
        switch (spec.getType()) {
            case SMA:
                return new SMAIndicator(closePrice, spec.param(0));
            case EMA:
                return new EMAIndicator(closePrice, spec.param(0));
            case RSI:
                return new RSIIndicator(closePrice, spec.param(0));
            case MACD:
                return new MACDIndicator(closePrice, spec.param(0), spec.param(1));
            case MACD_SIGNAL:
                return new EMAIndicator(new MACDIndicator(closePrice, spec.param(0), spec.param(1)), spec.param(2));
            case BB_UPPER:
                return new BollingerBandsUpperIndicator(bollingerMiddle(closePrice, spec.param(0)),
                        new StandardDeviationIndicator(closePrice, spec.param(0)));
            case BB_MIDDLE:
                return bollingerMiddle(closePrice, spec.param(0));
            case BB_LOWER:
                return new BollingerBandsLowerIndicator(bollingerMiddle(closePrice, spec.param(0)),
                        new StandardDeviationIndicator(closePrice, spec.param(0)));
            default:
                throw new IllegalArgumentException("Unsupported indicator: " + spec);
        }
    }

    private BollingerBandsMiddleIndicator bollingerMiddle(ClosePriceIndicator closePrice, int period) {
        return new BollingerBandsMiddleIndicator(new SMAIndicator(closePrice, period));
    }

    BarSeries createBarSeries(String name, List<Double> prices) {
        BarSeries series = new BaseBarSeriesBuilder().withName(name).build();
        ZonedDateTime endTime = SERIES_ORIGIN;
        for (Double price : prices) {
            endTime = endTime.plus(BAR_PERIOD);
            series.addBar(BAR_PERIOD, endTime, price, price, price, price, 0);
        }
        return series;
    }
}
