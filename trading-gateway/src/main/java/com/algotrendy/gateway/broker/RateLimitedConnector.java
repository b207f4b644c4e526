package com.algotrendy.gateway.broker;

import com.algotrendy.gateway.config.BrokerRateLimit;
import com.algotrendy.gateway.exception.InvalidConfigurationException;
import com.algotrendy.gateway.exception.NotConnectedException;
import com.algotrendy.gateway.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-broker connection state and request throttle.
 *
 * Features:
 * - Semaphore bounds the requests in flight on this connector
 * - Admission decided at wake-up under a short ReentrantLock, never held while waiting
 * - LockSupport.parkNanos() for the spacing wait, interruptible
 * - AtomicLong / AtomicReference for lock-free reads of state and counters
 *
 * Throttling never drops or fails a request; it only delays the calling thread.
 * An interrupted wait gives its concurrency slot back before returning and leaves no
 * reservation behind, so abandoned waits never delay later callers.
 */
public final class RateLimitedConnector {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitedConnector.class);

    private final String brokerName;
    private final int maxConcurrency;
    private final long minIntervalNanos;
    private final MetricsService metrics;

    private final Semaphore slots;

    // Guards lastAdmittedNanos only; released before parking
    private final ReentrantLock scheduleLock = new ReentrantLock();
    private long lastAdmittedNanos;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicReference<Instant> lastRequestTime = new AtomicReference<>();
    private final AtomicLong totalRequests = new AtomicLong(0);

    public RateLimitedConnector(String brokerName, int maxConcurrency, long minIntervalMs, MetricsService metrics) {
        if (brokerName == null || brokerName.isBlank()) {
            throw new InvalidConfigurationException("Broker name cannot be empty");
        }
        if (maxConcurrency <= 0) {
            throw new InvalidConfigurationException("Max concurrent requests must be positive: " + maxConcurrency);
        }
        if (minIntervalMs < 0) {
            throw new InvalidConfigurationException("Min interval cannot be negative: " + minIntervalMs);
        }
        this.brokerName = brokerName;
        this.maxConcurrency = maxConcurrency;
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(minIntervalMs);
        this.metrics = metrics;
        this.slots = new Semaphore(maxConcurrency, true);
        this.lastAdmittedNanos = System.nanoTime() - minIntervalNanos;

        logger.info("RateLimitedConnector initialized for {}: maxConcurrency={}, minInterval={}ms",
            brokerName, maxConcurrency, minIntervalMs);
    }

    public RateLimitedConnector(String brokerName, BrokerRateLimit limit, MetricsService metrics) {
        this(brokerName, limit.maxConcurrency(), limit.minIntervalMs(), metrics);
    }

    // ==================== THROTTLE ====================

    /**
     * Block until a concurrency slot is free and the minimum spacing since the previous
     * admitted request has elapsed. Close the returned permit when the request finishes.
     *
     * @throws InterruptedException if the caller is interrupted while waiting; no slot is held then
     */
    public Permit acquire() throws InterruptedException {
        long waitStart = System.nanoTime();
        slots.acquire();

        boolean admitted = false;
        try {
            long remaining;
            while ((remaining = tryAdmit()) > 0) {
                LockSupport.parkNanos(this, remaining);
                if (Thread.interrupted()) {
                    throw new InterruptedException("Throttle wait cancelled for " + brokerName);
                }
            }

            lastRequestTime.set(Instant.now());
            totalRequests.incrementAndGet();
            metrics.incrementBrokerRequests(brokerName);
            metrics.recordThrottleWait(brokerName, Duration.ofNanos(System.nanoTime() - waitStart));
            admitted = true;
            return new Permit();
        } finally {
            if (!admitted) {
                slots.release();
            }
        }
    }

    /**
     * Admit now if the spacing since the last admission has elapsed.
     *
     * @return 0 when admitted, otherwise the nanos left to wait
     */
    private long tryAdmit() {
        scheduleLock.lock();
        try {
            long now = System.nanoTime();
            long remaining = lastAdmittedNanos + minIntervalNanos - now;
            if (remaining <= 0) {
                lastAdmittedNanos = now;
                return 0;
            }
            return remaining;
        } finally {
            scheduleLock.unlock();
        }
    }

    /**
     * Throttle, then start the async call; the slot is released when the call's future completes.
     */
    public <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> call) {
        Permit permit;
        try {
            permit = acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            permit.close();
            return CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((result, error) -> permit.close());
    }

    // ==================== CONNECTION STATE ====================

    /**
     * @throws NotConnectedException unless the session is CONNECTED
     */
    public void ensureConnected() {
        if (state.get() != ConnectionState.CONNECTED) {
            throw new NotConnectedException(brokerName);
        }
    }

    /**
     * DISCONNECTED -> CONNECTING. Returns false if a connect is already underway or done.
     */
    public boolean beginConnect() {
        return state.compareAndSet(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);
    }

    public void markConnected() {
        state.set(ConnectionState.CONNECTED);
        logger.info("✅ {} connected", brokerName);
    }

    public void markDisconnected() {
        ConnectionState previous = state.getAndSet(ConnectionState.DISCONNECTED);
        if (previous != ConnectionState.DISCONNECTED) {
            logger.info("{} disconnected", brokerName);
        }
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED;
    }

    // ==================== MONITORING ====================

    public String getBrokerName() {
        return brokerName;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public long getMinIntervalMs() {
        return TimeUnit.NANOSECONDS.toMillis(minIntervalNanos);
    }

    public Optional<Instant> getLastRequestTime() {
        return Optional.ofNullable(lastRequestTime.get());
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public int getInFlight() {
        return maxConcurrency - slots.availablePermits();
    }

    /**
     * Concurrency slot held by one admitted request. Closing twice is harmless.
     */
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        }
    }
}
