package com.algotrendy.gateway.channel;

import com.algotrendy.gateway.exception.DataUnavailableException;
import com.algotrendy.gateway.exception.NotConnectedException;
import com.algotrendy.gateway.support.StubHttpResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BinanceChannel Tests")
class BinanceChannelTest {

    private static final String KLINES = """
        [
          [1709251200000,"60000.00","60100.00","59900.00","60050.00","12.5",1709251259999,"750000.0",420,"6","360000","0"],
          [1709251260000,"60050.00","60200.00","60000.00","60150.00","8.25",1709251319999,"496000.0",310,"4","240000","0"]
        ]
        """;

    @Mock
    private HttpClient httpClient;

    private BinanceChannel channel;

    @BeforeEach
    void setUp() {
        channel = new BinanceChannel(httpClient, new ObjectMapper());
    }

    private void respond(String symbol, int status, String body) throws Exception {
        doAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            String query = request.uri().getQuery();
            if (query != null && query.contains("symbol=" + symbol)) {
                return new StubHttpResponse(status, body);
            }
            return StubHttpResponse.ok("{}");
        }).when(httpClient).send(any(), any());
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Should map kline rows to candles")
        void shouldParseKlines() throws Exception {
            doReturn(StubHttpResponse.ok(KLINES)).when(httpClient).send(any(), any());

            FetchResult result = channel.fetchData(List.of("BTCUSDT"), "1m", 2);

            assertThat(result.status()).isEqualTo(FetchResult.Status.OK);
            MarketData first = result.records().get(0);
            assertThat(first.symbol()).isEqualTo("BTCUSDT");
            assertThat(first.exchange()).isEqualTo("binance");
            assertThat(first.timestamp()).isEqualTo(Instant.ofEpochMilli(1709251200000L));
            assertThat(first.open()).isEqualByComparingTo("60000");
            assertThat(first.high()).isEqualByComparingTo("60100");
            assertThat(first.low()).isEqualByComparingTo("59900");
            assertThat(first.close()).isEqualByComparingTo("60050");
            assertThat(first.volume()).isEqualByComparingTo("12.5");
            assertThat(first.quoteVolume()).isEqualByComparingTo("750000");
            assertThat(first.tradesCount()).isEqualTo(420L);
            assertThat(channel.totalMessagesReceived()).isEqualTo(2);
            assertThat(channel.lastDataReceivedAt()).isPresent();
        }

        @Test
        @DisplayName("Should drop candles that break OHLC ordering")
        void shouldDropInvalidCandles() throws Exception {
            doReturn(StubHttpResponse.ok("""
                [
                  [1709251200000,"60000","60100","59900","60050","1",0,"1",1],
                  [1709251260000,"60000","59000","59900","60050","1",0,"1",1]
                ]
                """)).when(httpClient).send(any(), any());

            assertThat(channel.fetchData(List.of("BTCUSDT"), "1m", 2).records()).hasSize(1);
        }

        @Test
        @DisplayName("Should report nothing new as an empty result")
        void shouldReportEmpty() throws Exception {
            doReturn(StubHttpResponse.ok("[]")).when(httpClient).send(any(), any());

            FetchResult result = channel.fetchData(List.of("BTCUSDT"), "1m", 10);

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.failedSymbols()).isZero();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should keep other symbols when one fails")
        void shouldIsolateSymbolFailures() throws Exception {
            doAnswer(invocation -> {
                HttpRequest request = invocation.getArgument(0);
                return request.uri().getQuery().contains("symbol=ETHUSDT")
                    ? new StubHttpResponse(400, "{\"code\":-1121,\"msg\":\"Invalid symbol.\"}")
                    : StubHttpResponse.ok(KLINES);
            }).when(httpClient).send(any(), any());

            FetchResult result = channel.fetchData(List.of("BTCUSDT", "ETHUSDT"), "1m", 2);

            assertThat(result.records()).hasSize(2).allMatch(candle -> candle.symbol().equals("BTCUSDT"));
            assertThat(result.failedSymbols()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail when every symbol fails")
        void shouldFailWhenAllSymbolsFail() throws Exception {
            doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());

            assertThatThrownBy(() -> channel.fetchData(List.of("BTCUSDT", "ETHUSDT"), "1m", 2))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("All 2 symbols failed");
        }

        @Test
        @DisplayName("Should fail on malformed JSON")
        void shouldFailOnMalformedJson() throws Exception {
            respond("BTCUSDT", 200, "<html>maintenance</html>");

            assertThatThrownBy(() -> channel.fetchData(List.of("BTCUSDT"), "1m", 2))
                .isInstanceOf(DataUnavailableException.class);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should ping on start and fetch subscribed symbols")
        void shouldUseSubscriptions() throws Exception {
            doReturn(StubHttpResponse.ok("{}"), StubHttpResponse.ok(KLINES)).when(httpClient).send(any(), any());

            channel.start();
            channel.subscribe(List.of("SOLUSDT"));
            FetchResult result = channel.fetchData(null, "1m", 2);

            assertThat(channel.isConnected()).isTrue();
            assertThat(channel.subscribedSymbols()).containsExactly("SOLUSDT");
            assertThat(result.records()).allMatch(candle -> candle.symbol().equals("SOLUSDT"));
        }

        @Test
        @DisplayName("Should require a connection to subscribe")
        void shouldRequireConnection() {
            assertThatThrownBy(() -> channel.subscribe(List.of("BTCUSDT")))
                .isInstanceOf(NotConnectedException.class);
        }

        @Test
        @DisplayName("Should not connect when the ping fails")
        void shouldFailStart() throws Exception {
            doReturn(new StubHttpResponse(503, "")).when(httpClient).send(any(), any());

            assertThatThrownBy(() -> channel.start()).isInstanceOf(DataUnavailableException.class);
            assertThat(channel.isConnected()).isFalse();
        }

        @Test
        @DisplayName("Should clear subscriptions on stop")
        void shouldStop() throws Exception {
            doReturn(StubHttpResponse.ok("{}")).when(httpClient).send(any(), any());
            channel.start();
            channel.subscribe(List.of("BTCUSDT"));

            channel.stop();
            channel.stop();

            assertThat(channel.isConnected()).isFalse();
            assertThat(channel.subscribedSymbols()).isEmpty();
        }
    }
}
