package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.channel.MarketData;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RangeBarBuilder Tests")
class RangeBarBuilderTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private RangeBarBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new RangeBarBuilder("BTCUSD", BigDecimal.TEN, "binance");
    }

    private List<RangeBar> price(String price, int second) {
        return builder.processPrice(new BigDecimal(price), BigDecimal.ONE, null, T0.plusSeconds(second), true);
    }

    @Test
    @DisplayName("Should close the bar once the range reaches the threshold")
    void shouldCloseAtThreshold() {
        assertThat(price("100", 0)).isEmpty();
        assertThat(price("105", 1)).isEmpty();
        assertThat(price("108", 2)).isEmpty();
        List<RangeBar> bars = price("111", 3);

        assertThat(bars).hasSize(1);
        RangeBar bar = bars.get(0);
        assertThat(bar.open()).isEqualByComparingTo("100");
        assertThat(bar.high()).isEqualByComparingTo("111");
        assertThat(bar.low()).isEqualByComparingTo("100");
        assertThat(bar.close()).isEqualByComparingTo("111");
        assertThat(bar.volume()).isEqualByComparingTo("4");
        assertThat(bar.tickCount()).isEqualTo(4);
        assertThat(bar.duration()).isEqualTo(Duration.ofSeconds(3));
        assertThat(builder.currentRange()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Should start a fresh bar after completion")
    void shouldStartFreshBar() {
        price("100", 0);
        price("110", 1);

        price("110", 2);
        assertThat(builder.currentStats().tickCount()).isEqualTo(1);
        assertThat(builder.progress()).isZero();
        price("105", 3);
        assertThat(builder.currentRange()).isEqualByComparingTo("5");
        assertThat(builder.progress()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should flush a partial bar on force complete")
    void shouldForceComplete() {
        price("100", 0);
        price("103", 1);

        RangeBar bar = builder.forceComplete().orElseThrow();

        assertThat(bar.high().subtract(bar.low())).isEqualByComparingTo("3");
        assertThat(builder.forceComplete()).isEmpty();
    }

    @Test
    @DisplayName("Should split volume by side and ignore unknown sides")
    void shouldSplitVolumeBySide() {
        builder.processPrice(new BigDecimal("100"), new BigDecimal("2"), null, T0, true);
        builder.processPrice(new BigDecimal("101"), new BigDecimal("3"), null, T0, false);
        builder.processPrice(new BigDecimal("102"), new BigDecimal("4"), null, T0, null);

        RangeBar bar = builder.forceComplete().orElseThrow();
        assertThat(bar.buyVolume()).isEqualByComparingTo("2");
        assertThat(bar.sellVolume()).isEqualByComparingTo("3");
        assertThat(bar.volume()).isEqualByComparingTo("9");
    }

    @Test
    @DisplayName("Should conserve volume across candles and force complete")
    void shouldConserveVolume() {
        List<RangeBar> bars = new ArrayList<>();
        BigDecimal input = BigDecimal.ZERO;
        String[][] candles = {
            {"100", "104", "99", "103", "1.5"},
            {"103", "115", "102", "114", "2.25"},
            {"114", "116", "90", "95", "7"},
            {"95", "97", "94", "96", "0.1"},
        };
        for (int i = 0; i < candles.length; i++) {
            String[] c = candles[i];
            BigDecimal volume = new BigDecimal(c[4]);
            input = input.add(volume);
            bars.addAll(builder.processCandle(MarketData.of("BTCUSD", "binance", T0.plusSeconds(60L * i),
                new BigDecimal(c[0]), new BigDecimal(c[1]), new BigDecimal(c[2]), new BigDecimal(c[3]), volume)));
        }
        builder.forceComplete().ifPresent(bars::add);

        BigDecimal output = bars.stream().map(RangeBar::volume).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(output).isEqualByComparingTo(input);
        assertThat(bars).hasSizeGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("Should size the threshold from ATR")
    void shouldCreateFromAtr() {
        List<MarketData> candles = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            candles.add(MarketData.of("BTCUSD", "binance", T0.plusSeconds(60L * i),
                new BigDecimal("100"), new BigDecimal("104"), new BigDecimal("100"), new BigDecimal("102"),
                BigDecimal.ONE));
        }

        RangeBarBuilder atrBuilder = RangeBarBuilder.createAtr("BTCUSD", candles, "binance", 13, new BigDecimal("2"));

        assertThat(atrBuilder.rangeThreshold()).isEqualByComparingTo("8");
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new RangeBarBuilder("BTCUSD", BigDecimal.ZERO, "binance"))
            .isInstanceOf(InvalidConfigurationException.class);
    }
}
