package com.tradesim;

import com.tradesim.config.Config;
import com.tradesim.engine.ActiveBotRegistry;
import com.tradesim.engine.BotScheduler;
import com.tradesim.engine.IndicatorService;
import com.tradesim.engine.PortfolioLedger;
import com.tradesim.engine.PortfolioValuator;
import com.tradesim.engine.TradingService;
import com.tradesim.infra.LedgerSeedLoader;
import com.tradesim.market.MarketDataStore;
import com.tradesim.market.PriceFeedService;
import com.tradesim.market.SimulatedPriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.Map;

@SpringBootApplication
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        SpringApplication.run(App.class, args);
    }

    @Bean
    public MarketDataStore marketDataStore() {
        return new MarketDataStore();
    }

    @Bean
    public SimulatedPriceSource simulatedPriceSource() {
        return new SimulatedPriceSource();
    }

    @Bean(destroyMethod = "stop")
    public PriceFeedService priceFeedService(MarketDataStore marketDataStore, SimulatedPriceSource priceSource) {
        return new PriceFeedService(marketDataStore, priceSource);
    }

    @Bean
    public IndicatorService indicatorService() {
        return new IndicatorService();
    }

    @Bean
    public PortfolioLedger portfolioLedger() {
        return new PortfolioLedger();
    }

    @Bean
    public PortfolioValuator portfolioValuator(MarketDataStore marketDataStore) {
        return new PortfolioValuator(marketDataStore);
    }

    @Bean
    public ActiveBotRegistry activeBotRegistry() {
        return new ActiveBotRegistry();
    }

    @Bean(destroyMethod = "shutdown")
    public BotScheduler botScheduler(MarketDataStore marketDataStore, IndicatorService indicatorService,
            PortfolioLedger portfolioLedger, PortfolioValuator portfolioValuator,
            ActiveBotRegistry activeBotRegistry) {
        return new BotScheduler(marketDataStore, indicatorService, portfolioLedger, portfolioValuator,
                activeBotRegistry);
    }

    @Bean
    public TradingService tradingService(PortfolioLedger portfolioLedger, MarketDataStore marketDataStore,
            PortfolioValuator portfolioValuator, ActiveBotRegistry activeBotRegistry) {
        return new TradingService(portfolioLedger, marketDataStore, portfolioValuator, activeBotRegistry);
    }

    @Bean
    public LedgerSeedLoader ledgerSeedLoader(PortfolioLedger portfolioLedger) {
        return new LedgerSeedLoader(portfolioLedger);
    }

    @Bean
    public CommandLineRunner seedLedger(LedgerSeedLoader seedLoader, PortfolioLedger portfolioLedger) {
        return args -> {
            String seedFile = Config.get(Config.LEDGER_SEED_FILE);
            if (seedFile != null && !seedFile.isBlank()) {
                seedLoader.load(Path.of(seedFile));
            } else {
                double startingBalance = Config.getDouble(Config.LEDGER_STARTING_BALANCE, 10000.0);
                portfolioLedger.openAccount("demo_user", "Demo User",
                        Map.of(portfolioLedger.getCurrency(), startingBalance));
                logger.info("💰 No seed file configured, opened demo_user with ${}", startingBalance);
            }
        };
    }

    @Bean
    public CommandLineRunner startPriceFeed(PriceFeedService priceFeedService, BotScheduler botScheduler) {
        return args -> {
            priceFeedService.start();
            logger.info("📊 Price feed started, bots tick every {}s", botScheduler.getTickInterval().getSeconds());
        };
    }
}
