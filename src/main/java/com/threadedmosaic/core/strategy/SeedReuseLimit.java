package com.threadedmosaic.core.strategy;

import com.threadedmosaic.core.model.Rgb;
import com.threadedmosaic.core.seed.SeedCatalog;
import com.threadedmosaic.core.seed.SeedImage;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts how many tiles of one build each seed has filled and steers matching away from seeds
 * that reached the cap. When every seed is at the cap the plain nearest seed is used again.
 */
final class SeedReuseLimit {

    private final int maxUses;
    private final ConcurrentHashMap<Integer, AtomicInteger> uses = new ConcurrentHashMap<>();

    SeedReuseLimit(int maxUses) {
        if (maxUses < 1) {
            throw new IllegalArgumentException("maxUses must be positive: " + maxUses);
        }
        this.maxUses = maxUses;
    }

    SeedImage claim(Rgb target, SeedCatalog seeds) {
        while (true) {
            SeedImage best = seeds.closestMatch(target, index -> uses(index) < maxUses);
            if (best == null) {
                SeedImage fallback = seeds.closestMatch(target);
                counter(fallback.index()).incrementAndGet();
                return fallback;
            }
            AtomicInteger counter = counter(best.index());
            int current = counter.get();
            // another tile may have taken the last slot since the scan
            if (current < maxUses && counter.compareAndSet(current, current + 1)) {
                return best;
            }
        }
    }

    int uses(int seedIndex) {
        AtomicInteger counter = uses.get(seedIndex);
        return counter == null ? 0 : counter.get();
    }

    private AtomicInteger counter(int seedIndex) {
        return uses.computeIfAbsent(seedIndex, k -> new AtomicInteger());
    }
}
