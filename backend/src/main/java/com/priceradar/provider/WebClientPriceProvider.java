package com.priceradar.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.common.ProviderException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.util.function.Consumer;

/**
 * Base for HTTP adapters: rate-limited blocking GET through WebClient with API key rotation.
 * Blocking with {@code Mono.block()} reacts to thread interruption, so a timed-out call abandons the exchange.
 */
@Slf4j
public abstract class WebClientPriceProvider implements PriceProvider {

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    protected final ObjectMapper objectMapper;
    private volatile String apiKey;

    protected WebClientPriceProvider(WebClient.Builder webClientBuilder, RateLimiter rateLimiter,
                                     ObjectMapper objectMapper, String apiKey) {
        this.webClient = webClientBuilder.build();
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.apiKey = blankToNull(apiKey);
    }

    @Override
    public void setApiKey(String apiKey) {
        this.apiKey = blankToNull(apiKey);
        log.info("API key {} for {}", this.apiKey == null ? "cleared" : "updated", getName());
    }

    @Override
    public boolean hasValidApiKey() {
        return apiKey != null;
    }

    protected String apiKey() {
        return apiKey;
    }

    /**
     * Name of the HTTP header carrying the API key.
     */
    protected abstract String apiKeyHeader();

    protected JsonNode getJson(String url) {
        String body = getBody(url);
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(getName(), ProviderException.Kind.INVALID_RESULT,
                    "Unparseable response from " + getName(), e);
        }
    }

    protected String getBody(String url) {
        if (rateLimiter != null && !rateLimiter.acquirePermission()) {
            throw new ProviderException(getName(), ProviderException.Kind.CALL_FAILED,
                    "Request budget exhausted for " + getName());
        }
        String key = apiKey;
        Consumer<org.springframework.http.HttpHeaders> headers = h -> {
            if (key != null) {
                h.set(apiKeyHeader(), key);
            }
        };
        try {
            String body = webClient.get()
                    .uri(url)
                    .headers(headers)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (body == null || body.isBlank()) {
                throw ProviderException.invalidResult(getName(), "empty body");
            }
            return body;
        } catch (WebClientResponseException e) {
            throw new ProviderException(getName(), ProviderException.Kind.CALL_FAILED,
                    getName() + " API error: " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        }
    }

    protected static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    protected static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
