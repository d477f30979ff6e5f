package com.priceradar.aggregation;

import com.priceradar.common.PriceUnavailableException;
import com.priceradar.common.ProviderException;
import com.priceradar.provider.PriceProvider;
import com.priceradar.provider.ProviderCapability;
import com.priceradar.registry.ProviderHealthTracker;
import com.priceradar.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Sequential fallback: walks providers in the given order, retrying each with backoff, and returns the first
 * valid result. Once a provider succeeds no further provider is queried.
 * Providers that are not registered, lack the capability, or are cooling down are skipped.
 * An interrupted caller ends the walk at once and is not counted against the provider.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FallbackChain {

    private final ProviderRegistry registry;
    private final ProviderCallExecutor callExecutor;

    /**
     * @param operation    label used in logs
     * @param order        provider names in fallback order
     * @param capability   capability a provider must declare to be tried
     * @param call         the provider call
     * @param isValid      success predicate; a result failing it counts as a failed attempt
     * @param settings     attempt settings per provider name
     * @param onExhausted  builds the exhaustion error from the last attempt error (may be null)
     */
    public <T> T resolve(String operation,
                         List<String> order,
                         ProviderCapability capability,
                         Function<PriceProvider, T> call,
                         Predicate<T> isValid,
                         Function<String, AttemptSettings> settings,
                         Function<Throwable, PriceUnavailableException> onExhausted) {
        ProviderHealthTracker health = registry.getHealthTracker();
        Throwable lastError = null;
        for (String name : order) {
            Optional<PriceProvider> registered = registry.getProvider(name);
            if (registered.isEmpty()) {
                log.debug("No adapter registered for {}, skipping", name);
                continue;
            }
            PriceProvider provider = registered.get();
            if (!provider.supports(capability)) {
                log.debug("{} does not support {}, skipping", name, capability);
                continue;
            }
            if (health.isCoolingDown(name)) {
                log.debug("{} is cooling down after repeated failures, skipping", name);
                continue;
            }
            AttemptSettings s = settings.apply(name);
            int total = s.retryPolicy().getTotalAttempts();
            for (int attempt = 0; attempt < total; attempt++) {
                try {
                    T result = callExecutor.call(name, () -> call.apply(provider), s.timeout());
                    if (!isValid.test(result)) {
                        throw ProviderException.invalidResult(name, String.valueOf(result));
                    }
                    health.recordSuccess(name);
                    return result;
                } catch (ProviderException e) {
                    if (e.getKind() == ProviderException.Kind.INTERRUPTED) {
                        // the caller was interrupted, not the provider: stop without blaming it
                        log.warn("{} interrupted while waiting for {}", operation, name);
                        throw onExhausted.apply(e);
                    }
                    lastError = e;
                    health.recordFailure(name);
                    log.warn("{} from {} failed (attempt {}/{}): {}", operation, name, attempt + 1, total, e.getMessage());
                    if (attempt < total - 1) {
                        pause(s.retryPolicy().delayMs(attempt), operation, e);
                    }
                }
            }
        }
        throw onExhausted.apply(lastError);
    }

    private static void pause(long delayMs, String operation, Throwable lastError) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            PriceUnavailableException ex = PriceUnavailableException.forOperation(operation + " (interrupted)", lastError);
            ex.addSuppressed(e);
            throw ex;
        }
    }
}
