package com.algotrendy.gateway.channel;

import com.algotrendy.gateway.bars.SymbolShardedAggregator;
import com.algotrendy.gateway.bars.TickBar;
import com.algotrendy.gateway.bars.TickBarBuilder;
import com.algotrendy.gateway.config.GatewayConfig;
import com.algotrendy.gateway.exception.DataUnavailableException;
import com.algotrendy.gateway.metrics.MetricsService;
import com.algotrendy.gateway.persistence.MarketDataRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatcher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@DisplayName("ChannelOrchestrator Tests")
class ChannelOrchestratorTest {

    private static final Instant BASE = Instant.ofEpochSecond(1_709_251_200L);

    private MarketDataRepository repository;
    private MetricsService metrics;
    private List<ChannelConnector> channels;
    private ChannelOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        repository = mock(MarketDataRepository.class);
        when(repository.insertBatch(anyList())).thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
        metrics = MetricsService.inMemory();

        channels = List.of(channel("kraken", 2), channel("binance", 0), channel("okx", 3), channel("coinbase", 1));
        when(channels.get(1).fetchData(isNull(), eq("1m"), eq(10)))
            .thenThrow(new DataUnavailableException("binance", "All 10 symbols failed"));

        Properties props = new Properties();
        props.setProperty("market-data.fetch-interval-seconds", "1");
        props.setProperty("market-data.startup-delay-seconds", "0");
        props.setProperty("market-data.limit", "10");
        orchestrator = new ChannelOrchestrator(channels, repository, metrics, GatewayConfig.forTest(props));
    }

    @AfterEach
    void tearDown() {
        orchestrator.stop();
    }

    private static ChannelConnector channel(String name, int candles) {
        ChannelConnector channel = mock(ChannelConnector.class);
        when(channel.exchangeName()).thenReturn(name);
        when(channel.isConnected()).thenReturn(true);
        when(channel.fetchData(isNull(), eq("1m"), eq(10))).thenReturn(FetchResult.of(candles(name, 0, candles), 0));
        return channel;
    }

    private static List<MarketData> candles(String exchange, int fromMinute, int toMinute) {
        List<MarketData> records = new ArrayList<>();
        for (int i = fromMinute; i < toMinute; i++) {
            BigDecimal price = BigDecimal.valueOf(100 + i);
            records.add(MarketData.of("BTCUSD", exchange, BASE.plusSeconds(60L * i),
                price, price, price, price, BigDecimal.ONE));
        }
        return records;
    }

    private static ArgumentMatcher<List<MarketData>> allFrom(String exchange) {
        return records -> !records.isEmpty() && records.stream().allMatch(r -> r.exchange().equals(exchange));
    }

    @Nested
    @DisplayName("Fetch Cycle")
    class FetchCycle {

        @Test
        @DisplayName("Should finish the cycle when one channel fails")
        void shouldIsolateChannelFailure() {
            CycleReport report = orchestrator.runCycle();

            assertThat(report.results()).hasSize(4);
            assertThat(report.successfulChannels()).isEqualTo(3);
            assertThat(report.failedChannels()).containsExactly("binance");
            assertThat(report.totalRecords()).isEqualTo(6);
            verify(repository, times(3)).insertBatch(anyList());
            verify(repository).insertBatch(argThat(allFrom("kraken")));
            verify(repository).insertBatch(argThat(allFrom("okx")));
            verify(repository).insertBatch(argThat(allFrom("coinbase")));
            verify(repository, never()).insertBatch(argThat(allFrom("binance")));
            assertThat(metrics.getRegistry().find("gateway.marketdata.channel.failures")
                .tag("channel", "binance").counter().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not persist or publish an empty fetch")
        void shouldSkipEmptyFetch() {
            when(channels.get(0).fetchData(isNull(), eq("1m"), eq(10))).thenReturn(FetchResult.empty());
            MarketDataListener listener = mock(MarketDataListener.class);
            orchestrator.addListener(listener);

            CycleReport report = orchestrator.runCycle();

            assertThat(report.results()).filteredOn(result -> result.channel().equals("kraken"))
                .singleElement().satisfies(result -> {
                    assertThat(result.success()).isTrue();
                    assertThat(result.records()).isZero();
                });
            verify(listener, never()).onMarketData(eq("kraken"), anyList());
            verify(repository, never()).insertBatch(argThat(allFrom("kraken")));
        }

        @Test
        @DisplayName("Should start channels that are not connected yet")
        void shouldStartDisconnectedChannels() {
            when(channels.get(2).isConnected()).thenReturn(false);

            orchestrator.runCycle();

            verify(channels.get(2)).start();
            verify(channels.get(0), never()).start();
        }

        @Test
        @DisplayName("Should deliver to every listener even if one throws")
        void shouldIsolateListenerFailures() {
            Map<String, Integer> received = new ConcurrentHashMap<>();
            orchestrator.addListener((exchange, records) -> {
                throw new IllegalStateException("listener bug");
            });
            orchestrator.addListener((exchange, records) -> received.put(exchange, records.size()));

            orchestrator.runCycle();

            assertThat(received).containsOnly(entry("kraken", 2), entry("okx", 3), entry("coinbase", 1));
        }
    }

    @Nested
    @DisplayName("Overlapping Windows")
    class OverlappingWindows {

        private ChannelConnector kraken;
        private ChannelOrchestrator overlapping;

        @BeforeEach
        void setUp() {
            kraken = channel("kraken", 0);
            Properties props = new Properties();
            props.setProperty("market-data.limit", "10");
            // Candles opening up to minute 3 are closed, minute 4 is still forming
            Clock clock = Clock.fixed(BASE.plusSeconds(60L * 4 + 30), ZoneOffset.UTC);
            overlapping = new ChannelOrchestrator(List.of(kraken), repository, metrics,
                GatewayConfig.forTest(props), clock);
        }

        @AfterEach
        void tearDown() {
            overlapping.stop();
        }

        @Test
        @DisplayName("Should hand each closed candle to listeners once")
        void shouldForwardOnlyNewCandles() {
            when(kraken.fetchData(isNull(), eq("1m"), eq(10))).thenReturn(
                FetchResult.of(candles("kraken", 0, 3), 0),
                FetchResult.of(candles("kraken", 1, 5), 0),
                FetchResult.of(candles("kraken", 2, 5), 0));
            List<Instant> forwarded = new CopyOnWriteArrayList<>();
            overlapping.addListener((exchange, records) -> records.forEach(r -> forwarded.add(r.timestamp())));

            overlapping.runCycle();
            overlapping.runCycle();
            overlapping.runCycle();

            assertThat(forwarded).containsExactly(BASE, BASE.plusSeconds(60), BASE.plusSeconds(120),
                BASE.plusSeconds(180));
            verify(repository, times(3)).insertBatch(anyList());
        }

        @Test
        @DisplayName("Should keep bar volume equal to the stored candle volume across cycles")
        void shouldConserveVolumeAcrossCycles() {
            when(kraken.fetchData(isNull(), eq("1m"), eq(10))).thenReturn(
                FetchResult.of(candles("kraken", 0, 3), 0),
                FetchResult.of(candles("kraken", 0, 4), 0));
            List<TickBar> bars = new CopyOnWriteArrayList<>();
            SymbolShardedAggregator<TickBar> tickBars = new SymbolShardedAggregator<>("tick-bars", 1,
                (source, symbol) -> new TickBarBuilder(symbol, 1_000, source), bars::addAll, metrics);
            overlapping.addListener(tickBars);

            try {
                overlapping.runCycle();
                overlapping.runCycle();
                tickBars.flush().join();
            } finally {
                tickBars.close();
            }

            assertThat(bars).singleElement().satisfies(bar -> {
                assertThat(bar.volume()).isEqualByComparingTo("4");
                assertThat(bar.tickCount()).isEqualTo(16);
                assertThat(bar.open()).isEqualByComparingTo("100");
                assertThat(bar.close()).isEqualByComparingTo("103");
            });
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should run cycles on the schedule until stopped")
        void shouldRunScheduledCycles() {
            orchestrator.start();

            verify(channels.get(0), timeout(5000).atLeast(2)).fetchData(isNull(), eq("1m"), eq(10));
            assertThat(orchestrator.isRunning()).isTrue();

            orchestrator.stop();

            assertThat(orchestrator.isRunning()).isFalse();
            channels.forEach(channel -> verify(channel).stop());
            assertThatThrownBy(() -> orchestrator.start()).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should report channel health")
        void shouldReportHealth() {
            when(channels.get(0).subscribedSymbols()).thenReturn(Set.of("XXBTZUSD"));
            when(channels.get(0).lastDataReceivedAt()).thenReturn(Optional.empty());
            when(channels.get(0).totalMessagesReceived()).thenReturn(42L);

            assertThat(orchestrator.channelHealth()).hasSize(4).first().satisfies(health -> {
                assertThat(health.channel()).isEqualTo("kraken");
                assertThat(health.lastDataReceivedAt()).isNull();
                assertThat(health.connected()).isTrue();
                assertThat(health.totalMessagesReceived()).isEqualTo(42L);
            });
        }

        @Test
        @DisplayName("Should require at least one channel")
        void shouldRequireChannels() {
            GatewayConfig config = GatewayConfig.forTest(new Properties());
            assertThatThrownBy(() -> new ChannelOrchestrator(List.of(), repository, metrics, config))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
