package com.algotrendy.gateway.bars;

import com.algotrendy.gateway.channel.MarketData;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RenkoBuilder Tests")
class RenkoBuilderTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private RenkoBuilder builder;

    @BeforeEach
    void setUp() {
        builder = RenkoBuilder.fixed("ETHUSD", BigDecimal.TEN, "coinbase");
    }

    private List<RenkoBrick> price(String price) {
        return builder.processPrice(new BigDecimal(price), BigDecimal.ONE, BigDecimal.ZERO, T0, null);
    }

    @Nested
    @DisplayName("Brick formation")
    class BrickFormation {

        @Test
        @DisplayName("Should anchor the first price to the nearest brick multiple")
        void shouldAnchorFirstPrice() {
            assertThat(price("104")).isEmpty();
            assertThat(builder.currentState().brickOpen()).isEqualByComparingTo("100");

            RenkoBuilder other = RenkoBuilder.fixed("ETHUSD", BigDecimal.TEN, "coinbase");
            other.processPrice(new BigDecimal("106"), BigDecimal.ONE, null, T0, null);
            assertThat(other.currentState().brickOpen()).isEqualByComparingTo("110");
        }

        @Test
        @DisplayName("Should emit exactly K chained bricks for a jump of K brick sizes")
        void shouldEmitKChainedBricks() {
            price("100");

            List<RenkoBrick> bricks = price("135");

            assertThat(bricks).hasSize(3);
            assertThat(bricks).allMatch(RenkoBrick::upBrick);
            for (int i = 0; i < bricks.size(); i++) {
                RenkoBrick brick = bricks.get(i);
                assertThat(brick.close().subtract(brick.open())).isEqualByComparingTo("10");
                if (i > 0) {
                    assertThat(brick.open()).isEqualByComparingTo(bricks.get(i - 1).close());
                }
            }
            assertThat(bricks.get(2).close()).isEqualByComparingTo("130");
        }

        @Test
        @DisplayName("Should emit down bricks with high and low at the brick ends")
        void shouldEmitDownBricks() {
            price("100");

            List<RenkoBrick> bricks = price("79");

            assertThat(bricks).hasSize(2);
            RenkoBrick first = bricks.get(0);
            assertThat(first.upBrick()).isFalse();
            assertThat(first.open()).isEqualByComparingTo("100");
            assertThat(first.close()).isEqualByComparingTo("90");
            assertThat(first.high()).isEqualByComparingTo("100");
            assertThat(first.low()).isEqualByComparingTo("90");
        }

        @Test
        @DisplayName("Should not form a brick inside the band")
        void shouldNotFormBrickInsideBand() {
            price("100");
            assertThat(price("109.99")).isEmpty();
            assertThat(price("90.01")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Reversals")
    class Reversals {

        @Test
        @DisplayName("Should never flag the first brick as a reversal")
        void shouldNotFlagFirstBrick() {
            price("100");
            List<RenkoBrick> bricks = price("89");

            assertThat(bricks).hasSize(1);
            assertThat(bricks.get(0).reversal()).isFalse();
        }

        @Test
        @DisplayName("Should flag a brick opposite to the previous one")
        void shouldFlagDirectionChange() {
            price("100");
            assertThat(price("111")).singleElement().satisfies(b -> assertThat(b.reversal()).isFalse());
            assertThat(price("121")).singleElement().satisfies(b -> assertThat(b.reversal()).isFalse());

            List<RenkoBrick> down = price("105");

            assertThat(down).hasSize(1);
            assertThat(down.get(0).upBrick()).isFalse();
            assertThat(down.get(0).reversal()).isTrue();
            assertThat(down.get(0).open()).isEqualByComparingTo("120");
        }
    }

    @Nested
    @DisplayName("Volume")
    class Volume {

        @Test
        @DisplayName("Should give accumulated volume to the first brick of a jump")
        void shouldAssignVolumeToFirstBrick() {
            price("100");
            price("105");
            List<RenkoBrick> bricks = price("131");

            assertThat(bricks).hasSize(3);
            assertThat(bricks.get(0).volume()).isEqualByComparingTo("3");
            assertThat(bricks.get(0).sourceDataPoints()).isEqualTo(3);
            assertThat(bricks.get(1).volume()).isEqualByComparingTo("0");
            assertThat(bricks.get(2).volume()).isEqualByComparingTo("0");
            assertThat(builder.currentState().pendingVolume()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Should conserve candle volume between bricks and pending volume")
        void shouldConserveVolume() {
            List<RenkoBrick> bricks = new ArrayList<>();
            BigDecimal input = BigDecimal.ZERO;
            String[][] candles = {
                {"100", "108", "97", "104", "2"},
                {"104", "131", "103", "129", "5.5"},
                {"129", "130", "88", "90", "3.3333"},
                {"90", "94", "89", "93", "1"},
            };
            for (int i = 0; i < candles.length; i++) {
                String[] c = candles[i];
                BigDecimal volume = new BigDecimal(c[4]);
                input = input.add(volume);
                bricks.addAll(builder.processCandle(MarketData.of("ETHUSD", "coinbase", T0.plusSeconds(60L * i),
                    new BigDecimal(c[0]), new BigDecimal(c[1]), new BigDecimal(c[2]), new BigDecimal(c[3]), volume)));
            }

            assertThat(builder.forceComplete()).isEmpty();
            BigDecimal output = bricks.stream().map(RenkoBrick::volume).reduce(BigDecimal.ZERO, BigDecimal::add)
                .add(builder.currentState().pendingVolume());
            assertThat(output).isEqualByComparingTo(input);
            assertThat(bricks).isNotEmpty();
        }
    }

    @Nested
    @DisplayName("Sizing")
    class Sizing {

        @Test
        @DisplayName("Should size bricks from ATR")
        void shouldSizeFromAtr() {
            List<MarketData> candles = new ArrayList<>();
            for (int i = 0; i < 14; i++) {
                candles.add(MarketData.of("ETHUSD", "coinbase", T0.plusSeconds(60L * i),
                    new BigDecimal("100"), new BigDecimal("103"), new BigDecimal("100"), new BigDecimal("101"),
                    BigDecimal.ONE));
            }

            RenkoBuilder atr = RenkoBuilder.atr("ETHUSD", candles, "coinbase");

            assertThat(atr.brickSize()).isEqualByComparingTo("3");
            assertThat(atr.sizingMethod()).isEqualTo("ATR(13)");
        }

        @Test
        @DisplayName("Should size bricks as a percentage of price")
        void shouldSizeFromPercentage() {
            RenkoBuilder pct = RenkoBuilder.percentage("ETHUSD", new BigDecimal("2000"), new BigDecimal("1"), "coinbase");

            assertThat(pct.brickSize()).isEqualByComparingTo("20");
            assertThat(pct.sizingMethod()).isEqualTo("Percentage(1%)");
        }

        @Test
        @DisplayName("Should reject invalid sizes")
        void shouldRejectInvalidSizes() {
            assertThatThrownBy(() -> RenkoBuilder.fixed("ETHUSD", new BigDecimal("-1"), "coinbase"))
                .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> RenkoBuilder.percentage("ETHUSD", BigDecimal.TEN, new BigDecimal("101"), "coinbase"))
                .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> RenkoBuilder.atr("ETHUSD", List.of(), "coinbase"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
