package com.prediction.market.trading_engine.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.junit.jupiter.api.Test;

import com.prediction.market.trading_engine.engine.PredictionPricingEngine.BuyQuote;
import com.prediction.market.trading_engine.engine.PredictionPricingEngine.SellQuote;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.exception.InvalidTradeException;
import com.prediction.market.trading_engine.exception.MarketClosedException;
import com.prediction.market.trading_engine.exception.ValidationException;

class PredictionPricingEngineTest {

    private final PredictionPricingEngine engine = new PredictionPricingEngine(new BigDecimal("0.01"));

    private static Market market(String yes, String no) {
        return Market.builder()
            .id("m1")
            .yesReserve(new BigDecimal(yes))
            .noReserve(new BigDecimal(no))
            .constantProduct(new BigDecimal(yes).multiply(new BigDecimal(no)))
            .build();
    }

    @Test
    void buyYesMovesNetSpendIntoNoReserve() {
        BuyQuote quote = engine.quoteBuy(market("500", "500"), Outcome.YES, Money.of("250"));

        assertThat(quote.fee()).isEqualTo(Money.of("2.5"));
        assertThat(quote.netAmount()).isEqualTo(Money.of("247.5"));
        assertThat(quote.newNoReserve()).isEqualByComparingTo("747.5");
        assertThat(quote.newYesReserve()).isEqualByComparingTo("334.448160535117056856");
        assertThat(quote.sharesOut()).isEqualTo(Money.of("165.55183946"));
        assertThat(quote.totalCost()).isEqualTo(Money.of("250"));
    }

    @Test
    void buyKeepsConstantProduct() {
        BuyQuote quote = engine.quoteBuy(Money.of("1200"), Money.of("800"), Outcome.NO, Money.of("75.5"));

        BigDecimal product = quote.newYesReserve().multiply(quote.newNoReserve());
        assertThat(product).isCloseTo(new BigDecimal("960000"), within(new BigDecimal("0.001")));
    }

    @Test
    void constantProductHoldsForLargeReserves() {
        BigDecimal tolerance = new BigDecimal("0.001");
        for (String reserve : new String[] {"1000000", "250000000", "1000000000000"}) {
            Money r = Money.of(reserve);
            BigDecimal k = r.toBigDecimal().multiply(r.toBigDecimal());
            for (int i = 1; i <= 300; i++) {
                Money amount = Money.of(new BigDecimal(reserve).multiply(new BigDecimal(i))
                    .divide(new BigDecimal("160000"), 8, RoundingMode.HALF_EVEN).add(new BigDecimal("0.13")));

                BuyQuote buy = engine.quoteBuy(r, r, i % 2 == 0 ? Outcome.YES : Outcome.NO, amount);
                assertThat(buy.newYesReserve().multiply(buy.newNoReserve())).isCloseTo(k, within(tolerance));

                SellQuote sell = engine.quoteSell(r, r, i % 2 == 0 ? Outcome.NO : Outcome.YES, amount);
                assertThat(sell.newYesReserve().multiply(sell.newNoReserve())).isCloseTo(k, within(tolerance));
            }
        }
    }

    @Test
    void sellingBoughtSharesRestoresReserves() {
        Market market = market("500", "500");
        BuyQuote buy = engine.quoteBuy(market, Outcome.YES, Money.of("250"));
        market.setYesReserve(buy.newYesReserve());
        market.setNoReserve(buy.newNoReserve());

        SellQuote sell = engine.quoteSell(market, Outcome.YES, buy.sharesOut());

        assertThat(Money.of(sell.newYesReserve())).isEqualTo(Money.of("500"));
        assertThat(Money.of(sell.newNoReserve())).isEqualTo(Money.of("500"));
        assertThat(sell.grossProceeds()).isEqualTo(Money.of("247.5"));
        assertThat(sell.fee()).isEqualTo(Money.of("2.475"));
        assertThat(sell.netProceeds()).isEqualTo(Money.of("245.025"));
    }

    @Test
    void buyingRaisesProbabilityOfThatSide() {
        Money yes = Money.of("500");
        Money no = Money.of("500");
        assertThat(engine.price(yes, no, Outcome.YES)).isEqualTo(Money.of("0.5"));

        BuyQuote quote = engine.quoteBuy(yes, no, Outcome.YES, Money.of("100"));
        Money newYes = Money.of(quote.newYesReserve());
        Money newNo = Money.of(quote.newNoReserve());
        Money yesPrice = engine.price(newYes, newNo, Outcome.YES);
        Money noPrice = engine.price(newYes, newNo, Outcome.NO);

        assertThat(yesPrice.isGreaterThan(Money.of("0.5"))).isTrue();
        assertThat(yesPrice.add(noPrice).toBigDecimal()).isCloseTo(BigDecimal.ONE, within(new BigDecimal("0.00000002")));
    }

    @Test
    void largerBuysFillAtWorseAveragePrice() {
        BuyQuote small = engine.quoteBuy(Money.of("500"), Money.of("500"), Outcome.YES, Money.of("10"));
        BuyQuote large = engine.quoteBuy(Money.of("500"), Money.of("500"), Outcome.YES, Money.of("400"));

        Money marginal = engine.marginalPrice(Money.of("500"), Money.of("500"), Outcome.YES);
        assertThat(marginal).isEqualTo(Money.ONE);
        assertThat(small.averagePrice().isGreaterThan(marginal)).isTrue();
        assertThat(large.averagePrice().isGreaterThan(small.averagePrice())).isTrue();
    }

    @Test
    void sellProceedsNeverExceedOppositeReserve() {
        SellQuote quote = engine.quoteSell(Money.of("500"), Money.of("500"), Outcome.NO, Money.of("1000000"));

        assertThat(quote.grossProceeds().isLessThan(Money.of("500"))).isTrue();
        assertThat(quote.newYesReserve().signum()).isPositive();
    }

    @Test
    void rejectsNonPositiveAmounts() {
        assertThatThrownBy(() -> engine.quoteBuy(Money.of("500"), Money.of("500"), Outcome.YES, Money.ZERO))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> engine.quoteSell(Money.of("500"), Money.of("500"), Outcome.YES, Money.of("-1")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> engine.quoteBuy(Money.of("500"), Money.of("500"), null, Money.ONE))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsEmptyReserves() {
        assertThatThrownBy(() -> engine.quoteBuy(Money.ZERO, Money.of("500"), Outcome.YES, Money.ONE))
            .isInstanceOf(InvalidTradeException.class);
        assertThatThrownBy(() -> engine.price(Money.of("500"), Money.ZERO, Outcome.NO))
            .isInstanceOf(InvalidTradeException.class);
    }

    @Test
    void rejectsBuyConsumedByFee() {
        PredictionPricingEngine expensive = new PredictionPricingEngine(new BigDecimal("0.9"));

        assertThatThrownBy(() -> expensive.quoteBuy(Money.of("500"), Money.of("500"), Outcome.YES, Money.of("0.00000001")))
            .isInstanceOf(InvalidTradeException.class)
            .hasMessageContaining("fee");
    }

    @Test
    void refusesToQuoteResolvedMarket() {
        Market market = market("500", "500");
        market.setResolved(true);
        market.setOutcome(true);

        assertThatThrownBy(() -> engine.quoteBuy(market, Outcome.YES, Money.of("10")))
            .isInstanceOf(MarketClosedException.class);
        assertThatThrownBy(() -> engine.quoteSell(market, Outcome.YES, Money.of("10")))
            .isInstanceOf(MarketClosedException.class);
    }

    @Test
    void feeRateMustBeBelowOne() {
        assertThatThrownBy(() -> new PredictionPricingEngine(BigDecimal.ONE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PredictionPricingEngine(new BigDecimal("-0.01")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
