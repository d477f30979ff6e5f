package com.priceradar.registry;

import com.priceradar.provider.PriceProvider;
import com.priceradar.provider.ProviderCapability;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registered provider adapters and the priority list that defines fallback order.
 * <p>
 * Invariant: every registered name appears exactly once in the priority list. The list may also hold names with
 * no adapter (configured but not available); those are skipped at resolution time.
 * Reads return snapshots, so resolutions in flight are not affected by concurrent mutation.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, PriceProvider> providers = new LinkedHashMap<>();
    private final List<String> priority = new ArrayList<>();
    private final Map<String, String> apiKeys = new HashMap<>();
    private final ProviderHealthTracker healthTracker;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ProviderRegistry(List<String> initialPriority, ProviderHealthTracker healthTracker) {
        if (initialPriority != null) {
            new LinkedHashSet<>(initialPriority).stream()
                    .filter(n -> n != null && !n.isBlank())
                    .forEach(priority::add);
        }
        this.healthTracker = healthTracker;
    }

    /**
     * Registers or replaces an adapter; appends its name to the priority list when absent.
     */
    public boolean addApiSource(String name, PriceProvider provider) {
        if (name == null || name.isBlank() || provider == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            providers.put(name, provider);
            if (!priority.contains(name)) {
                priority.add(name);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered provider {} (priority {})", name, priorityList());
        return true;
    }

    /**
     * Registers or replaces an adapter and moves it to the given index (0 = first), clamped to the list end.
     */
    public boolean addApiSource(String name, PriceProvider provider, int position) {
        if (name == null || name.isBlank() || provider == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            providers.put(name, provider);
            priority.remove(name);
            int index = Math.max(0, Math.min(position, priority.size()));
            priority.add(index, name);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered provider {} at position {} (priority {})", name, position, priorityList());
        return true;
    }

    public boolean removeApiSource(String name) {
        lock.writeLock().lock();
        try {
            if (name == null || !providers.containsKey(name)) {
                return false;
            }
            providers.remove(name);
            priority.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
        healthTracker.forget(name);
        log.info("Removed provider {}", name);
        return true;
    }

    /**
     * Stores the key even when no adapter is registered under name; rotates it on the adapter when it supports keys.
     */
    public boolean updateApiKey(String name, String apiKey) {
        if (name == null || name.isBlank()) {
            return false;
        }
        PriceProvider provider;
        lock.writeLock().lock();
        try {
            apiKeys.put(name, apiKey);
            provider = providers.get(name);
        } finally {
            lock.writeLock().unlock();
        }
        if (provider != null && provider.supports(ProviderCapability.KEY_ROTATION)) {
            provider.setApiKey(apiKey);
        }
        return true;
    }

    /**
     * Replaces the priority list. Registered providers missing from newOrder are appended after it in their
     * current relative order. Duplicates in newOrder are dropped.
     */
    public boolean updateApiPriority(List<String> newOrder) {
        if (newOrder == null || newOrder.isEmpty()) {
            return false;
        }
        lock.writeLock().lock();
        try {
            LinkedHashSet<String> ordered = new LinkedHashSet<>();
            for (String name : newOrder) {
                if (name == null || name.isBlank()) {
                    continue;
                }
                if (!providers.containsKey(name)) {
                    log.warn("Provider {} in new priority order is not registered", name);
                }
                ordered.add(name);
            }
            if (ordered.isEmpty()) {
                return false;
            }
            for (String current : priority) {
                if (providers.containsKey(current)) {
                    ordered.add(current);
                }
            }
            ordered.addAll(providers.keySet());
            priority.clear();
            priority.addAll(ordered);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Provider priority updated to {}", priorityList());
        return true;
    }

    /**
     * Fallback order for one call: the stored list, or preferred first (when registered) followed by the rest
     * with preferred removed. The stored list is not changed.
     */
    public List<String> effectiveOrder(String preferred) {
        lock.readLock().lock();
        try {
            if (preferred == null || !providers.containsKey(preferred)) {
                return List.copyOf(priority);
            }
            List<String> order = new ArrayList<>(priority.size() + 1);
            order.add(preferred);
            for (String name : priority) {
                if (!name.equals(preferred)) {
                    order.add(name);
                }
            }
            return Collections.unmodifiableList(order);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> priorityList() {
        return effectiveOrder(null);
    }

    public Optional<PriceProvider> getProvider(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Registered adapters in registration order.
     */
    public Map<String, PriceProvider> getProviders() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> getApiKey(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(apiKeys.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public ProviderHealthTracker getHealthTracker() {
        return healthTracker;
    }
}
