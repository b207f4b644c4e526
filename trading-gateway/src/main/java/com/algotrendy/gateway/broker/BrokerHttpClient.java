package com.algotrendy.gateway.broker;

import com.algotrendy.gateway.exception.BrokerUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Throttled JSON transport shared by the broker gateways.
 *
 * Every request goes through the broker's {@link RateLimitedConnector}. Transport errors,
 * 429 and 5xx responses complete exceptionally with {@link BrokerUnavailableException};
 * other responses are handed back with their status so the gateway can map venue errors.
 */
final class BrokerHttpClient {
    private static final Logger logger = LoggerFactory.getLogger(BrokerHttpClient.class);

    private final String brokerName;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RateLimitedConnector connector;

    BrokerHttpClient(String brokerName, HttpClient httpClient, ObjectMapper objectMapper,
                     RateLimitedConnector connector) {
        this.brokerName = brokerName;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.connector = connector;
    }

    CompletableFuture<JsonResponse> send(HttpRequest request) {
        return connector.submit(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
            .handle((response, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                    logger.error("{} request {} {} failed: {}", brokerName, request.method(),
                        request.uri().getPath(), cause.getMessage());
                    throw new CompletionException(
                        new BrokerUnavailableException(brokerName, "Request failed: " + cause.getMessage(), cause));
                }

                int status = response.statusCode();
                if (status == 429 || status >= 500) {
                    logger.warn("{} returned HTTP {} for {}", brokerName, status, request.uri().getPath());
                    throw new CompletionException(
                        new BrokerUnavailableException(brokerName, "HTTP " + status));
                }
                return new JsonResponse(status, parse(response.body()));
            });
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CompletionException(
                new BrokerUnavailableException(brokerName, "Malformed response: " + e.getOriginalMessage(), e));
        }
    }

    ObjectMapper mapper() {
        return objectMapper;
    }

    RateLimitedConnector connector() {
        return connector;
    }

    /**
     * Parsed response body with its HTTP status.
     */
    record JsonResponse(int statusCode, JsonNode body) {

        boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
