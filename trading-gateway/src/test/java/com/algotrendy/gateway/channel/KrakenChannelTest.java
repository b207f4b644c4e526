package com.algotrendy.gateway.channel;

import com.algotrendy.gateway.exception.DataUnavailableException;
import com.algotrendy.gateway.support.StubHttpResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("KrakenChannel Tests")
class KrakenChannelTest {

    private static final String OHLC = """
        {"error":[],"result":{"XXBTZUSD":[
          [1709251200,"60000.0","60100.0","59900.0","60050.0","60010.5","1.25",42],
          [1709251260,"60050.0","60200.0","60000.0","60150.0","60100.1","0.75",17],
          [1709251320,"60150.0","60300.0","60100.0","60250.0","60200.2","2.00",33]
        ],"last":1709251260}}
        """;

    @Mock
    private HttpClient httpClient;

    private KrakenChannel channel;

    @BeforeEach
    void setUp() {
        channel = new KrakenChannel(httpClient, new ObjectMapper());
    }

    @Test
    @DisplayName("Should normalize pair names and keep the VWAP")
    void shouldParseOhlc() throws Exception {
        doReturn(StubHttpResponse.ok(OHLC)).when(httpClient).send(any(), any());

        List<MarketData> candles = channel.fetchData(List.of("XXBTZUSD"), "1m", 10).records();

        assertThat(candles).hasSize(3);
        MarketData first = candles.get(0);
        assertThat(first.symbol()).isEqualTo("BTCUSD");
        assertThat(first.exchange()).isEqualTo("kraken");
        assertThat(first.timestamp()).isEqualTo(Instant.ofEpochSecond(1709251200));
        assertThat(first.volume()).isEqualByComparingTo("1.25");
        assertThat(first.tradesCount()).isEqualTo(42L);
        assertThat(first.metadataJson()).contains("\"vwap\":\"60010.5\"");
    }

    @Test
    @DisplayName("Should keep only the newest rows up to the limit")
    void shouldApplyLimit() throws Exception {
        doReturn(StubHttpResponse.ok(OHLC)).when(httpClient).send(any(), any());

        List<MarketData> candles = channel.fetchData(List.of("XXBTZUSD"), "1m", 2).records();

        assertThat(candles).extracting(candle -> candle.timestamp().getEpochSecond())
            .containsExactly(1709251260L, 1709251320L);
    }

    @Test
    @DisplayName("Should request the nearest supported interval")
    void shouldMapInterval() throws Exception {
        doReturn(StubHttpResponse.ok(OHLC)).when(httpClient).send(any(), any());

        channel.fetchData(List.of("XXBTZUSD"), "4h", 10);

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().getQuery()).isEqualTo("pair=XXBTZUSD&interval=240");
    }

    @Test
    @DisplayName("Should treat an API error as a failed symbol")
    void shouldFailOnApiError() throws Exception {
        doReturn(StubHttpResponse.ok("{\"error\":[\"EQuery:Unknown asset pair\"]}"))
            .when(httpClient).send(any(), any());

        assertThatThrownBy(() -> channel.fetchData(List.of("NOPEUSD"), "1m", 10))
            .isInstanceOf(DataUnavailableException.class);
    }
}
