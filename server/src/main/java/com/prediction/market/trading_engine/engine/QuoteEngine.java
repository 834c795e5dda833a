package com.prediction.market.trading_engine.engine;

import com.prediction.market.trading_engine.cache.MarketStore;
import com.prediction.market.trading_engine.engine.PredictionPricingEngine.BuyQuote;
import com.prediction.market.trading_engine.engine.PredictionPricingEngine.SellQuote;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpSide;
import com.prediction.market.trading_engine.exception.InvalidTradeException;
import com.prediction.market.trading_engine.exception.ValidationException;
import com.prediction.market.trading_engine.feed.PriceFeed;

/**
 * Side-effect-free previews for display, served from the market cache. A preview is not a promise: the
 * execution path re-quotes against fresh state under lock.
 */
public class QuoteEngine {

    public record PerpPreview(
        Money entryPrice,
        Money markPrice,
        Money size,
        Money fee,
        Money requiredFunds,
        Money liquidationPrice
    ) {
    }

    private final MarketStore marketStore;
    private final PredictionPricingEngine pricingEngine;
    private final PerpRiskEngine riskEngine;
    private final PriceFeed priceFeed;

    public QuoteEngine(MarketStore marketStore, PredictionPricingEngine pricingEngine,
                       PerpRiskEngine riskEngine, PriceFeed priceFeed) {
        this.marketStore = marketStore;
        this.pricingEngine = pricingEngine;
        this.riskEngine = riskEngine;
        this.priceFeed = priceFeed;
    }

    public BuyQuote previewBuy(String marketId, Outcome side, Money amount) {
        return pricingEngine.quoteBuy(market(marketId), side, amount);
    }

    public SellQuote previewSell(String marketId, Outcome side, Money shares) {
        return pricingEngine.quoteSell(market(marketId), side, shares);
    }

    public Money spotPrice(String marketId, Outcome side) {
        Market market = market(marketId);
        return pricingEngine.price(Money.of(market.getYesReserve()), Money.of(market.getNoReserve()), side);
    }

    public PerpPreview previewPerp(String ticker, PerpSide side, Money margin, int leverage) {
        if (margin == null || !margin.isPositive()) {
            throw new ValidationException("Margin must be positive");
        }
        PerpMarket market = marketStore.getPerpMarket(ticker)
            .orElseThrow(() -> new ValidationException("Perp market not found: " + ticker));
        if (leverage > market.getMaxLeverage()) {
            throw new ValidationException(String.format("Leverage %d above %s maximum of %d",
                leverage, ticker, market.getMaxLeverage()));
        }

        Money index = priceFeed.getIndexPrice(ticker)
            .filter(p -> p.signum() > 0)
            .map(Money::of)
            .orElseThrow(() -> new InvalidTradeException("No index price available for " + ticker));
        Money size = riskEngine.positionSize(margin, leverage);
        Money fee = riskEngine.tradingFee(size);

        return new PerpPreview(
            index,
            riskEngine.markPrice(index, Money.orZero(market.getLastTradePrice()), market.getFundingRate()),
            size,
            fee,
            margin.add(fee),
            riskEngine.liquidationPrice(index, side, leverage));
    }

    private Market market(String marketId) {
        return marketStore.getMarket(marketId)
            .orElseThrow(() -> new ValidationException("Market not found: " + marketId));
    }
}
