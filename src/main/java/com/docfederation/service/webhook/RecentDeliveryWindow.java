package com.docfederation.service.webhook;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.time.Duration;

/**
 * Bounded, time-expiring set of recently accepted delivery keys.
 */
public class RecentDeliveryWindow {

    private final Cache<String, Boolean> seen;

    public RecentDeliveryWindow(Duration window, long maxEntries) {
        this(window, maxEntries, Ticker.systemTicker());
    }

    public RecentDeliveryWindow(Duration window, long maxEntries, Ticker ticker) {
        this.seen = CacheBuilder.newBuilder()
                .expireAfterWrite(window)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .build();
    }

    /**
     * Records {@code key}.
     *
     * @return true if it was not seen within the window
     */
    public boolean markIfFirst(String key) {
        return seen.asMap().putIfAbsent(key, Boolean.TRUE) == null;
    }

    /**
     * Forgets {@code key}, so a later delivery of it is processed again.
     */
    public void forget(String key) {
        seen.invalidate(key);
    }
}
