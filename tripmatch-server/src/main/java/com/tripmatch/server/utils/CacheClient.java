package com.tripmatch.server.utils;

import com.github.benmanes.caffeine.cache.Cache;
import com.tripmatch.common.exception.CacheUnavailableException;
import com.tripmatch.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 缓存读写的统一入口：未命中回源计算并写回，命中直接返回。
 *
 * <p>缓存只是优化手段，不是正确性依赖：缓存后端的任何异常都会被包装为 {@link CacheUnavailableException}，
 * 记录日志与指标后直接回退到计算结果，绝不抛给调用方。回源计算本身抛出的异常照常向上传播。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheClient {

    private final MetricsRecorder metricsRecorder;

    /**
     * @param cacheName 指标与日志中使用的缓存名
     * @param cache     为 null 表示缓存已关闭，直接计算
     * @param loader    回源计算，返回 null 时不写缓存
     */
    public <K, V> V queryWithFallback(String cacheName, Cache<K, V> cache, K key, Supplier<V> loader) {
        if (cache == null) {
            return loader.get();
        }
        V cached = read(cacheName, cache, key);
        if (cached != null) {
            metricsRecorder.recordCacheAccess(cacheName, "hit");
            return cached;
        }
        metricsRecorder.recordCacheAccess(cacheName, "miss");
        V fresh = loader.get();
        if (fresh != null) {
            write(cacheName, cache, key, fresh);
        }
        return fresh;
    }

    private <K, V> V read(String cacheName, Cache<K, V> cache, K key) {
        try {
            return cache.getIfPresent(key);
        } catch (RuntimeException e) {
            onUnavailable(cacheName, new CacheUnavailableException("read " + cacheName + " failed, key=" + key, e));
            return null;
        }
    }

    private <K, V> void write(String cacheName, Cache<K, V> cache, K key, V value) {
        try {
            cache.put(key, value);
        } catch (RuntimeException e) {
            onUnavailable(cacheName, new CacheUnavailableException("write " + cacheName + " failed, key=" + key, e));
        }
    }

    private void onUnavailable(String cacheName, CacheUnavailableException e) {
        metricsRecorder.recordCacheAccess(cacheName, "error");
        log.warn("缓存不可用，回退到直接计算: {}", e.getMessage(), e);
    }
}
