/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.region;

import ai.evacortex.tienvelope.core.exceptions.AtlasUnavailableException;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * Keeps resolved atlases in memory so that repeated region queries against the same atlas
 * (one per label in a whole-head analysis) load it once.
 */
public final class CachingAtlasResolver implements AtlasResolver {

    private static final long CFG_MAX_ATLASES = Long.getLong("tienvelope.cache.maxAtlases", 16L);

    private final LoadingCache<String, AtlasLookup> cache;

    public CachingAtlasResolver(AtlasResolver delegate) {
        this(delegate, CFG_MAX_ATLASES);
    }

    public CachingAtlasResolver(AtlasResolver delegate, long maxAtlases) {
        Objects.requireNonNull(delegate, "delegate must not be null");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxAtlases)
                .build(delegate::resolve);
    }

    @Override
    public AtlasLookup resolve(String atlasPath) {
        try {
            AtlasLookup lookup = cache.get(atlasPath);
            if (lookup == null) throw new AtlasUnavailableException(atlasPath);
            return lookup;
        } catch (CompletionException e) {
            throw new AtlasUnavailableException(atlasPath, e.getCause() != null ? e.getCause() : e);
        } catch (AtlasUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AtlasUnavailableException(atlasPath, e);
        }
    }

    public long cachedCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidate(String atlasPath) {
        cache.invalidate(atlasPath);
    }
}
