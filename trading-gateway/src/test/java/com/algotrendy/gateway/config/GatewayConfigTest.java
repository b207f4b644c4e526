package com.algotrendy.gateway.config;

import com.algotrendy.gateway.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GatewayConfig Tests")
class GatewayConfigTest {

    private static Properties props(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return props;
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Should use built-in defaults for missing keys")
        void shouldUseDefaults() {
            GatewayConfig config = GatewayConfig.forTest(new Properties());

            assertThat(config.getFetchIntervalSeconds()).isEqualTo(60);
            assertThat(config.getStartupDelaySeconds()).isEqualTo(5);
            assertThat(config.getMarketDataInterval()).isEqualTo("1m");
            assertThat(config.getMarketDataLimit()).isEqualTo(100);
            assertThat(config.getChannels()).containsExactly("kraken", "binance", "okx", "coinbase");
            assertThat(config.getClientOrderIdPrefix()).isEqualTo("AT");
            assertThat(config.getTickBarSize()).isEqualTo(100);
            assertThat(config.getRenkoAtrPeriod()).isEqualTo(13);
            assertThat(config.isBinanceTestnet()).isTrue();
        }

        @Test
        @DisplayName("Should load the classpath config.properties")
        void shouldLoadClasspathFile() {
            GatewayConfig config = GatewayConfig.load();

            assertThat(config.getFetchIntervalSeconds()).isEqualTo(1);
            assertThat(config.getChannels()).containsExactly("kraken", "binance");
            assertThat(config.getAggregatorShards()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should normalize the channel list")
        void shouldNormalizeChannels() {
            GatewayConfig config = GatewayConfig.forTest(props("market-data.channels", " Kraken, ,OKX "));

            assertThat(config.getChannels()).containsExactly("kraken", "okx");
        }

        @Test
        @DisplayName("Should fall back to the default on an unparsable number")
        void shouldFallBackOnBadNumber() {
            GatewayConfig config = GatewayConfig.forTest(props(
                "market-data.limit", "lots",
                "bars.range-threshold", "ten"));

            assertThat(config.getMarketDataLimit()).isEqualTo(100);
            assertThat(config.getRangeBarThreshold()).isEqualByComparingTo("10");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject values outside their bounds")
        void shouldRejectInvalidValues() {
            assertThatThrownBy(() -> GatewayConfig.forTest(props(
                "market-data.fetch-interval-seconds", "0",
                "bars.renko-brick-size", "-5")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Fetch interval must be positive")
                .hasMessageContaining("Renko brick size must be positive");
        }

        @Test
        @DisplayName("Should reject a non-alphanumeric client order id prefix")
        void shouldRejectBadPrefix() {
            assertThatThrownBy(() -> GatewayConfig.forTest(props("orders.client-id-prefix", "A-T")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("alphanumeric");
        }

        @Test
        @DisplayName("Should require at least one channel")
        void shouldRequireChannels() {
            assertThatThrownBy(() -> GatewayConfig.forTest(props("market-data.channels", " , ")))
                .isInstanceOf(InvalidConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Brokers")
    class Brokers {

        @Test
        @DisplayName("Should use broker presets unless overridden")
        void shouldResolveRateLimits() {
            GatewayConfig config = GatewayConfig.forTest(props("broker.kraken.min-interval-ms", "250"));

            assertThat(config.rateLimitFor("binance")).isEqualTo(BrokerRateLimit.BINANCE);
            assertThat(config.rateLimitFor("Kraken")).isEqualTo(new BrokerRateLimit(10, 250));
            assertThat(config.rateLimitFor("unknown")).isEqualTo(new BrokerRateLimit(10, 100));
        }

        @Test
        @DisplayName("Should read credentials from the file when absent from the environment")
        void shouldReadCredentials() {
            GatewayConfig config = GatewayConfig.forTest(props(
                "ALGOTRENDY_TEST_ONLY_KEY", "  file-value ",
                "ALGOTRENDY_TEST_ONLY_BLANK", " "));

            assertThat(config.getCredential("ALGOTRENDY_TEST_ONLY_KEY")).contains("file-value");
            assertThat(config.getCredential("ALGOTRENDY_TEST_ONLY_BLANK")).isEmpty();
            assertThat(config.getCredential("ALGOTRENDY_TEST_ONLY_MISSING")).isEmpty();
        }
    }
}
