package com.tradesim.engine;

import com.tradesim.market.MarketDataStore;
import com.tradesim.model.TradeSide;
import com.tradesim.model.TradingPair;
import com.tradesim.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Manual trading and cash movements requested by a user.
 */
public class TradingService {
    private static final Logger logger = LoggerFactory.getLogger(TradingService.class);

    private final PortfolioLedger ledger;
    private final MarketDataStore marketData;
    private final PortfolioValuator valuator;
    private final ActiveBotRegistry registry;

    public TradingService(PortfolioLedger ledger, MarketDataStore marketData, PortfolioValuator valuator,
            ActiveBotRegistry registry) {
        this.ledger = ledger;
        this.marketData = marketData;
        this.valuator = valuator;
        this.registry = registry;
    }

    /**
     * Buy or sell {@code quantity} units of {@code base} priced in {@code quote}.
     * Refused while the user's bot is running, since the bot owns the account's trading.
     */
    public Transaction trade(String userId, String base, String quote, TradeSide side, double quantity)
            throws TradeRejectedException {
        TradingPair pair = parsePair(base, quote);
        // the bot check and the trade share one hold of the account lock, which a bot start also takes
        return ledger.withAccountLocked(userId, () -> {
            if (registry.isActive(userId)) {
                logger.warn("Manual {} of {} refused for {}: bot is running", side, pair, userId);
                throw new TradeRejectedException(RejectionReason.BOT_ACTIVE,
                        "Stop the running bot before trading manually");
            }

            OptionalDouble price = marketData.pairPrice(base, quote);
            if (price.isEmpty()) {
                throw new TradeRejectedException(RejectionReason.PRICE_UNAVAILABLE, "No price for " + pair);
            }
            return ledger.executeTrade(userId, pair, side, quantity, price.getAsDouble(),
                    valuator.usdPrice(base), valuator.usdPrice(quote), null);
        });
    }

    private static TradingPair parsePair(String base, String quote) throws TradeRejectedException {
        try {
            return TradingPair.of(base, quote);
        } catch (IllegalArgumentException e) {
            throw new TradeRejectedException(RejectionReason.INVALID_QUANTITY, e.getMessage());
        }
    }

    public Transaction deposit(String userId, double amount) throws TradeRejectedException {
        return ledger.deposit(userId, amount);
    }

    public Transaction withdraw(String userId, double amount) throws TradeRejectedException {
        return ledger.withdraw(userId, amount);
    }
}
