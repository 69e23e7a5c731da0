package com.example.demo.sheetgen.service;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the template source cache, for diagnostics.
 */
@Service
@RequiredArgsConstructor
public class TemplateCacheInspector {
    public static final String TEMPLATE_SOURCES_CACHE = "reportTemplateSources";

    private final CacheManager cacheManager;

    public Map<String, Object> inspect() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cacheName", TEMPLATE_SOURCES_CACHE);

        Cache cache = cacheManager.getCache(TEMPLATE_SOURCES_CACHE);
        if (cache == null) {
            out.put("error", "Cache not found");
            return out;
        }
        if (!(cache instanceof CaffeineCache)) {
            out.put("message", "Cache is not a CaffeineCache; native inspection unavailable");
            return out;
        }
        com.github.benmanes.caffeine.cache.Cache<Object, Object> nativeCache = ((CaffeineCache) cache).getNativeCache();
        out.put("estimatedSize", nativeCache.estimatedSize());
        out.put("keys", nativeCache.asMap().keySet());

        CacheStats stats = nativeCache.stats();
        Map<String, Object> statsMap = new LinkedHashMap<>();
        statsMap.put("hitCount", stats.hitCount());
        statsMap.put("missCount", stats.missCount());
        statsMap.put("evictionCount", stats.evictionCount());
        out.put("stats", statsMap);
        return out;
    }
}
