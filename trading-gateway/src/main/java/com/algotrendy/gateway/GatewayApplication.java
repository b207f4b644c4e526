package com.algotrendy.gateway;

import com.algotrendy.gateway.bars.RangeBar;
import com.algotrendy.gateway.bars.RangeBarBuilder;
import com.algotrendy.gateway.bars.RenkoBrick;
import com.algotrendy.gateway.bars.RenkoBuilder;
import com.algotrendy.gateway.bars.SymbolShardedAggregator;
import com.algotrendy.gateway.bars.TickBar;
import com.algotrendy.gateway.bars.TickBarBuilder;
import com.algotrendy.gateway.broker.BinanceGateway;
import com.algotrendy.gateway.broker.BrokerGateway;
import com.algotrendy.gateway.broker.BrokerRouter;
import com.algotrendy.gateway.broker.CoinbaseGateway;
import com.algotrendy.gateway.broker.KrakenGateway;
import com.algotrendy.gateway.broker.RateLimitedConnector;
import com.algotrendy.gateway.channel.BinanceChannel;
import com.algotrendy.gateway.channel.ChannelConnector;
import com.algotrendy.gateway.channel.ChannelOrchestrator;
import com.algotrendy.gateway.channel.CoinbaseChannel;
import com.algotrendy.gateway.channel.KrakenChannel;
import com.algotrendy.gateway.channel.MarketData;
import com.algotrendy.gateway.channel.OkxChannel;
import com.algotrendy.gateway.config.GatewayConfig;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import com.algotrendy.gateway.execution.OrderExecutionService;
import com.algotrendy.gateway.metrics.MetricsService;
import com.algotrendy.gateway.order.OrderIdempotencyService;
import com.algotrendy.gateway.persistence.BarRepository;
import com.algotrendy.gateway.persistence.MarketDataRepository;
import com.algotrendy.gateway.persistence.OrderRepository;
import com.algotrendy.gateway.persistence.SqliteBarRepository;
import com.algotrendy.gateway.persistence.SqliteMarketDataRepository;
import com.algotrendy.gateway.persistence.SqliteOrderRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Gateway entry point: wires market data, bars and order execution from config.properties
 * and runs until the process is stopped.
 */
public final class GatewayApplication {
    private static final Logger logger = LoggerFactory.getLogger(GatewayApplication.class);

    private final GatewayConfig config;
    private final MetricsService metrics;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final ValidatorFactory validatorFactory = Validation.buildDefaultValidatorFactory();
    private final MarketDataRepository marketDataRepository;
    private final OrderRepository orderRepository;
    private final BarRepository barRepository;

    private final ChannelOrchestrator orchestrator;
    private final List<SymbolShardedAggregator<?>> aggregators = new ArrayList<>();
    private final BrokerRouter router;
    private final OrderExecutionService executionService;

    GatewayApplication(GatewayConfig config, MetricsService metrics) {
        this.config = config;
        this.metrics = metrics;

        this.marketDataRepository = new SqliteMarketDataRepository(config.getDatabasePath());
        this.orderRepository = new SqliteOrderRepository(config.getDatabasePath());
        this.barRepository = new SqliteBarRepository(config.getDatabasePath());

        this.orchestrator = new ChannelOrchestrator(buildChannels(), marketDataRepository, metrics, config);
        buildBarPipeline();

        this.router = new BrokerRouter(buildGateways());
        var idempotency = new OrderIdempotencyService(orderRepository, config.getClientOrderIdPrefix(),
            validatorFactory.getValidator());
        this.executionService = new OrderExecutionService(idempotency, orderRepository, router, metrics);
    }

    public static void main(String[] args) {
        logger.info("🚀 Starting AlgoTrendy Trading Gateway...");
        GatewayApplication app = new GatewayApplication(GatewayConfig.load(), MetricsService.prometheus());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping gateway...");
            app.stop();
            stopped.countDown();
        }, "gateway-shutdown"));

        app.start();
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Gateway interrupted");
        }
    }

    // ==================== WIRING ====================

    private List<ChannelConnector> buildChannels() {
        List<ChannelConnector> channels = new ArrayList<>();
        for (String name : config.getChannels()) {
            switch (name) {
                case "kraken" -> channels.add(new KrakenChannel(httpClient, mapper));
                case "binance" -> channels.add(new BinanceChannel(httpClient, mapper));
                case "okx" -> channels.add(new OkxChannel(httpClient, mapper));
                case "coinbase" -> channels.add(new CoinbaseChannel(httpClient, mapper));
                default -> throw new InvalidConfigurationException("Unknown market data channel: " + name);
            }
        }
        return channels;
    }

    private void buildBarPipeline() {
        int shards = config.getAggregatorShards();

        var tickBars = new SymbolShardedAggregator<TickBar>("tick-bars", shards,
            (source, symbol) -> new TickBarBuilder(symbol, config.getTickBarSize(), source),
            barRepository::save, metrics);
        var rangeBars = new SymbolShardedAggregator<RangeBar>("range-bars", shards,
            (source, symbol) -> new RangeBarBuilder(symbol, config.getRangeBarThreshold(), source),
            barRepository::save, metrics);
        var renkoBricks = new SymbolShardedAggregator<RenkoBrick>("renko-bricks", shards,
            this::renkoBuilder, barRepository::save, metrics);

        for (var aggregator : List.of(tickBars, rangeBars, renkoBricks)) {
            orchestrator.addListener(aggregator);
            aggregators.add(aggregator);
        }
    }

    /**
     * ATR-sized bricks when the store holds enough history for the pair, fixed size otherwise.
     */
    private RenkoBuilder renkoBuilder(String source, String symbol) {
        int period = config.getRenkoAtrPeriod();
        Instant to = Instant.now();
        Instant from = to.minus(Duration.ofDays(1));
        List<MarketData> history = marketDataRepository.findBySymbol(symbol, from, to).stream()
            .filter(candle -> candle.exchange().equals(source))
            .toList();
        if (history.size() > period) {
            try {
                return RenkoBuilder.atr(symbol, history.subList(history.size() - period - 1, history.size()),
                    source, period);
            } catch (InvalidConfigurationException e) {
                logger.warn("ATR sizing failed for {} {}: {}", source, symbol, e.getMessage());
            }
        }
        logger.info("Not enough history for ATR bricks on {} {} ({} candles), using fixed size {}",
            source, symbol, history.size(), config.getRenkoBrickSize());
        return RenkoBuilder.fixed(symbol, config.getRenkoBrickSize(), source);
    }

    private List<BrokerGateway> buildGateways() {
        List<BrokerGateway> gateways = new ArrayList<>();

        var krakenKey = config.getCredential("KRAKEN_API_KEY");
        var krakenSecret = config.getCredential("KRAKEN_API_SECRET");
        if (krakenKey.isPresent() && krakenSecret.isPresent()) {
            gateways.add(new KrakenGateway(krakenKey.get(), krakenSecret.get(), connector("kraken"),
                httpClient, mapper));
        }

        var coinbaseKey = config.getCredential("COINBASE_API_KEY_NAME");
        var coinbasePem = config.getCredential("COINBASE_PRIVATE_KEY");
        if (coinbaseKey.isPresent() && coinbasePem.isPresent()) {
            gateways.add(new CoinbaseGateway(coinbaseKey.get(), coinbasePem.get(), connector("coinbase"),
                httpClient, mapper));
        }

        var binanceKey = config.getCredential("BINANCE_API_KEY");
        var binanceSecret = config.getCredential("BINANCE_API_SECRET");
        if (binanceKey.isPresent() && binanceSecret.isPresent()) {
            gateways.add(new BinanceGateway(binanceKey.get(), binanceSecret.get(), config.isBinanceTestnet(),
                connector("binance"), httpClient, mapper));
        }

        if (gateways.isEmpty()) {
            logger.warn("⚠️ No broker credentials configured, order execution disabled");
        }
        return gateways;
    }

    private RateLimitedConnector connector(String broker) {
        return new RateLimitedConnector(broker, config.rateLimitFor(broker), metrics);
    }

    // ==================== LIFECYCLE ====================

    void start() {
        Map<String, Boolean> connected = router.connectAll().join();
        connected.forEach((exchange, ok) ->
            logger.info("{} {} broker", ok ? "✅ Connected to" : "❌ Failed to connect to", exchange));

        orchestrator.start();
        logger.info("✅ Gateway running: {} broker(s), channels {}", router.exchanges().size(), config.getChannels());
    }

    void stop() {
        orchestrator.stop();
        aggregators.forEach(SymbolShardedAggregator::close);
        router.disconnectAll();
        barRepository.close();
        orderRepository.close();
        marketDataRepository.close();
        validatorFactory.close();
        logger.info("Gateway shutdown complete");
    }

    public OrderExecutionService executionService() {
        return executionService;
    }

    public ChannelOrchestrator orchestrator() {
        return orchestrator;
    }
}
