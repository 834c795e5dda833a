package com.prediction.market.trading_engine.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.trading_engine.TradingFixture;
import com.prediction.market.trading_engine.engine.PredictionPricingEngine.BuyQuote;
import com.prediction.market.trading_engine.engine.QuoteEngine.PerpPreview;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpSide;
import com.prediction.market.trading_engine.exception.InvalidTradeException;
import com.prediction.market.trading_engine.exception.ValidationException;

class QuoteEngineTest {

    private TradingFixture fixture;
    private QuoteEngine quotes;

    @BeforeEach
    void setUp() {
        fixture = new TradingFixture();
        fixture.market("m1", "500", "500");
        fixture.perpMarket("BTC", "100", "0");
        quotes = fixture.quotes;
    }

    @Test
    void previewMatchesExecutionQuote() {
        BuyQuote preview = quotes.previewBuy("m1", Outcome.YES, Money.of("250"));

        assertThat(preview.sharesOut()).isEqualTo(Money.of("165.55183946"));
        assertThat(quotes.spotPrice("m1", Outcome.NO)).isEqualTo(Money.of("0.5"));
        assertThat(quotes.previewSell("m1", Outcome.NO, Money.of("10")).grossProceeds().isPositive()).isTrue();
        // previews never write
        assertThat(fixture.store.findMarket("m1").orElseThrow().getYesReserve()).isEqualByComparingTo("500");
    }

    @Test
    void perpPreviewIncludesFeeAndLiquidationPrice() {
        PerpPreview preview = quotes.previewPerp("BTC", PerpSide.LONG, Money.of("100"), 3);

        assertThat(preview.entryPrice()).isEqualTo(Money.of("100"));
        assertThat(preview.markPrice()).isEqualTo(Money.of("100"));
        assertThat(preview.size()).isEqualTo(Money.of("300"));
        assertThat(preview.fee()).isEqualTo(Money.of("0.3"));
        assertThat(preview.requiredFunds()).isEqualTo(Money.of("100.3"));
        assertThat(preview.liquidationPrice()).isEqualTo(Money.of("70"));
    }

    @Test
    void perpPreviewRespectsMarketLimits() {
        fixture.store.savePerpMarket(PerpMarket.builder()
            .ticker("SOL")
            .indexPrice(new BigDecimal("150"))
            .fundingRate(BigDecimal.ZERO)
            .maxLeverage(10)
            .build());

        assertThatThrownBy(() -> quotes.previewPerp("SOL", PerpSide.SHORT, Money.of("100"), 20))
            .isInstanceOf(ValidationException.class);
        // no feed price for SOL
        assertThatThrownBy(() -> quotes.previewPerp("SOL", PerpSide.SHORT, Money.of("100"), 5))
            .isInstanceOf(InvalidTradeException.class);
        assertThatThrownBy(() -> quotes.previewPerp("NOPE", PerpSide.LONG, Money.of("100"), 5))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> quotes.previewBuy("missing", Outcome.YES, Money.ONE))
            .isInstanceOf(ValidationException.class);
    }
}
