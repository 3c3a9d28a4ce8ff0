package com.tradesim.engine;

import com.tradesim.market.MarketDataStore;
import com.tradesim.model.BotState;
import com.tradesim.model.Decision;
import com.tradesim.model.PricePoint;
import com.tradesim.model.TradingPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives single cycles by hand so every step of the cycle is deterministic.
 */
public class BotTaskTest {

    private static final TradingPair BTC_USD = TradingPair.of("BTC", "USD");
    private static final Instant START = Instant.parse("2025-01-21T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(START, ZoneOffset.UTC);

    private MarketDataStore marketData;
    private PortfolioLedger ledger;
    private PortfolioValuator valuator;
    private ActiveBotRegistry registry;
    private int tick;

    @BeforeEach
    public void setUp() {
        marketData = new MarketDataStore(1000, "USD");
        ledger = new PortfolioLedger("USD", 10.0, 100000.0, CLOCK);
        valuator = new PortfolioValuator(marketData);
        registry = new ActiveBotRegistry(CLOCK);
        tick = 0;
    }

    private void price(double btc) {
        marketData.append(new PricePoint(START.plusSeconds(5L * tick++), "BTC", btc));
    }

    private BotInstance launch(String userId, ScriptedStrategy strategy, double stoploss) {
        double initial = valuator.totalValue(ledger.snapshot(userId).orElseThrow().getBalances());
        BotInstance instance = new BotInstance(userId, strategy, BTC_USD, stoploss, initial, START);
        assertTrue(registry.tryStart(userId, instance));
        assertTrue(instance.markRunning());
        return instance;
    }

    private BotTask task(BotInstance instance) {
        return new BotTask(instance, marketData, new IndicatorService(), ledger, valuator, registry, CLOCK, 720);
    }

    private int historySize(String userId) {
        return ledger.snapshot(userId).orElseThrow().getHistory().size();
    }

    @Test
    public void testAppliesTradesAndReportsThemToTheStrategy() {
        ledger.openAccount("alice", "Alice", Map.of("USD", 10000.0));
        price(50000);
        ScriptedStrategy strategy = ScriptedStrategy.always(Decision.buy(100.0));
        BotInstance instance = launch("alice", strategy, 500.0);
        BotTask task = task(instance);

        task.run();
        task.run();
        task.run();

        assertEquals(List.of(0L, 1L, 2L), strategy.cyclesSeen, "Cycle counter starts at zero");
        assertEquals(3, strategy.executed.size());
        assertEquals("scripted", strategy.executed.get(0).getExecutedByBot());
        assertEquals(50000.0, strategy.executed.get(0).getBaseUsdPrice(), 1e-9);
        assertEquals(9700.0, ledger.balance("alice", "USD"), 1e-6);
        assertEquals(BotState.RUNNING, instance.getState());
        assertEquals(3, instance.getCycleCount());
    }

    @Test
    public void testStoplossTripsBeforeTheCyclesTrade() {
        // 0.25 BTC at $40,000 is exactly $10,000
        ledger.openAccount("alice", "Alice", Map.of("BTC", 0.25, "USD", 1000.0));
        price(40000);
        ScriptedStrategy strategy = ScriptedStrategy.always(Decision.sell(100.0));
        BotInstance instance = launch("alice", strategy, 500.0);
        assertEquals(11000.0, instance.getInitialValue(), 1e-9);
        BotTask task = task(instance);

        price(38400); // value 10600, loss 400
        task.run();
        assertEquals(BotState.RUNNING, instance.getState());
        assertEquals(1, historySize("alice"));

        price(37900); // about 0.2474 BTC * 37,900 + 1,100 = 10,476, loss 524
        task.run();
        assertEquals(BotState.STOPLOSS_TRIGGERED, instance.getState());
        assertEquals(1, historySize("alice"), "The tripping cycle must not trade");
        assertEquals(1, strategy.executed.size());
        assertFalse(registry.isActive("alice"));
        assertEquals(BotState.STOPLOSS_TRIGGERED, registry.status("alice").getState());

        task.run();
        assertEquals(2, strategy.cyclesSeen.size(), "Nothing runs after a terminal state");
    }

    @Test
    public void testStoplossScenarioTenThousandFiveHundred() {
        ledger.openAccount("bob", "Bob", Map.of("USD", 10000.0));
        price(50000);
        ScriptedStrategy strategy = ScriptedStrategy.always(Decision.buy(2000.0));
        BotInstance instance = launch("bob", strategy, 500.0);
        BotTask task = task(instance);

        task.run(); // 0.04 BTC bought at 50,000
        price(47500);
        task.run(); // value 9,900 at cycle start; 2,000 more at 47,500
        assertEquals(2, historySize("bob"));

        price(45000); // about 6,000 USD + 0.0821 BTC * 45,000 = 9,695
        task.run();
        assertEquals(3, historySize("bob"));

        price(42000); // about 4,000 USD + 0.1265 BTC * 42,000 = 9,315, past the $500 threshold
        task.run();
        assertEquals(BotState.STOPLOSS_TRIGGERED, instance.getState());
        assertEquals(3, historySize("bob"), "No trade once value fell to $9,500 or below");
        assertTrue(registry.status("bob").getReason().contains("stoploss"));
    }

    @Test
    public void testStoplossTripsExactlyAtThreshold() {
        ledger.openAccount("carol", "Carol", Map.of("BTC", 0.25));
        price(40000);
        BotInstance instance = launch("carol", ScriptedStrategy.always(Decision.hold()), 500.0);
        BotTask task = task(instance);

        price(38004); // loss 499
        task.run();
        assertEquals(BotState.RUNNING, instance.getState());

        price(38000); // loss exactly 500
        task.run();
        assertEquals(BotState.STOPLOSS_TRIGGERED, instance.getState());
    }

    @Test
    public void testShortfallEndsWithInsufficientFunds() {
        ledger.openAccount("dave", "Dave", Map.of("USD", 50.0));
        price(50000);
        BotInstance buyer = launch("dave", ScriptedStrategy.always(Decision.buy(100.0)), 1000.0);

        task(buyer).run();

        assertEquals(BotState.INSUFFICIENT_FUNDS, buyer.getState());
        assertEquals(50.0, ledger.balance("dave", "USD"), 1e-9);
        assertEquals(0, historySize("dave"));

        ledger.openAccount("erin", "Erin", Map.of("USD", 5000.0));
        BotInstance seller = launch("erin", ScriptedStrategy.always(Decision.sell(100.0)), 1000.0);
        task(seller).run();
        assertEquals(BotState.INSUFFICIENT_FUNDS, seller.getState(), "Selling assets not held is a shortfall too");
    }

    @Test
    public void testNonPositiveAmountEndsWithInvalidDecision() {
        ledger.openAccount("frank", "Frank", Map.of("USD", 5000.0));
        price(50000);
        BotInstance instance = launch("frank", ScriptedStrategy.always(Decision.buy(0.0)), 1000.0);

        task(instance).run();

        assertEquals(BotState.INVALID_DECISION, instance.getState());
        assertEquals(0, historySize("frank"));
    }

    @Test
    public void testStrategyFailureEndsWithErrored() {
        ledger.openAccount("gina", "Gina", Map.of("USD", 5000.0));
        price(50000);
        ScriptedStrategy broken = new ScriptedStrategy("broken", context -> {
            throw new ArithmeticException("divide by zero");
        });
        BotInstance instance = launch("gina", broken, 1000.0);

        assertDoesNotThrow(() -> task(instance).run());

        assertEquals(BotState.ERRORED, instance.getState());
        assertTrue(registry.status("gina").getReason().contains("divide by zero"));
        assertEquals(0, historySize("gina"));
    }

    @Test
    public void testFatalErrorEndsWithErroredAndFreesTheUser() {
        ledger.openAccount("gail", "Gail", Map.of("USD", 5000.0));
        price(50000);
        ScriptedStrategy broken = new ScriptedStrategy("broken", context -> {
            throw new AssertionError("impossible branch");
        });
        BotInstance instance = launch("gail", broken, 1000.0);

        // the error still reaches the executor so the periodic task dies with it
        assertThrows(AssertionError.class, () -> task(instance).run());

        assertEquals(BotState.ERRORED, instance.getState());
        assertFalse(registry.isActive("gail"), "User can start a new bot");
        assertTrue(registry.status("gail").getReason().contains("impossible branch"));
        assertEquals(0, historySize("gail"));
    }

    @Test
    public void testMissingPriceSkipsCycleWithoutEndingBot() {
        ledger.openAccount("hank", "Hank", Map.of("USD", 5000.0));
        ScriptedStrategy strategy = ScriptedStrategy.always(Decision.buy(100.0));
        BotInstance instance = launch("hank", strategy, 1000.0);
        BotTask task = task(instance);

        task.run();

        assertEquals(BotState.RUNNING, instance.getState());
        assertTrue(strategy.cyclesSeen.isEmpty(), "No context without a price");
        assertEquals(1, instance.getCycleCount());

        price(50000);
        task.run();
        assertEquals(List.of(1L), strategy.cyclesSeen);
        assertEquals(1, historySize("hank"));
    }

    @Test
    public void testStopDuringDecisionPreventsTheTrade() {
        ledger.openAccount("ivy", "Ivy", Map.of("USD", 5000.0));
        price(50000);
        ScriptedStrategy strategy = new ScriptedStrategy("slow", context -> {
            // stop request lands while the strategy is still deciding
            registry.stop("ivy");
            return Decision.buy(100.0);
        });
        BotInstance instance = launch("ivy", strategy, 1000.0);

        task(instance).run();

        assertEquals(BotState.STOPPED, instance.getState());
        assertEquals(0, historySize("ivy"));
        assertTrue(strategy.executed.isEmpty());
    }

    @Test
    public void testContextCarriesBalancesAndRequestedIndicators() {
        ledger.openAccount("jack", "Jack", Map.of("USD", 5000.0, "BTC", 0.5));
        for (int i = 0; i < 30; i++) {
            price(50000 + i);
        }
        double[] seen = new double[3];
        ScriptedStrategy strategy = new ScriptedStrategy("probe", context -> {
            seen[0] = context.getBaseBalance();
            seen[1] = context.getQuoteBalance();
            seen[2] = context.getPriceWindow().size();
            return Decision.hold();
        }) {
            @Override
            public Set<IndicatorSpec> requiredIndicators() {
                return Set.of(IndicatorSpec.sma(5));
            }
        };
        BotInstance instance = launch("jack", strategy, 1000.0);

        task(instance).run();

        assertEquals(0.5, seen[0], 1e-12);
        assertEquals(5000.0, seen[1], 1e-9);
        assertEquals(30, (int) seen[2]);
    }
}
