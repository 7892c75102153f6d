/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

import ai.evacortex.tienvelope.core.field.ImageVolume;
import ai.evacortex.tienvelope.core.stats.StatisticsEngine;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jboss.logging.Logger;

/**
 * Memoizes the grid-percentile window {@code [low, high]} of an image, keyed by content hash,
 * so that re-running an intersection with another overlap threshold does not re-sort every image.
 */
public final class HighValueWindowCache {

    private static final Logger LOG = Logger.getLogger(HighValueWindowCache.class);

    private static final long CFG_MAX_IMAGES = Long.getLong("tienvelope.cache.maxImages", 256L);

    private record WindowKey(long contentHash, int voxelCount, double pLow, double pHigh) {}

    private final Cache<WindowKey, double[]> cache;

    public HighValueWindowCache() {
        this(CFG_MAX_IMAGES);
    }

    public HighValueWindowCache(long maxImages) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxImages)
                .recordStats()
                .build();
    }

    /** {low, high} grid percentiles of the image's non-zero finite values; NaNs for an all-zero image. */
    public double[] window(ImageVolume image, double pLow, double pHigh) {
        WindowKey key = new WindowKey(ImageHashing.contentHash(image), image.voxelCount(), pLow, pHigh);
        double[] window = cache.get(key, k -> {
            LOG.debugf("Computing %.1f-%.1f percentile window for image %016x", pLow, pHigh, k.contentHash());
            return StatisticsEngine.gridPercentiles(image.data(), pLow, pHigh);
        });
        return window.clone();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public void clear() {
        cache.invalidateAll();
    }
}
