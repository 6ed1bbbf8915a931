package com.tripmatch.server.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.tripmatch.common.properties.CacheProperties;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.TripCandidate;
import com.tripmatch.server.utils.CacheClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 推荐缓存层，两级相互独立的本地缓存：
 * <ul>
 *     <li>归一化偏好缓存：原始偏好指纹 -> SearchPreferences，TTL 以小时计；</li>
 *     <li>行程得分缓存：(候选内容, 偏好指纹, 权重版本) -> (特征向量, 得分)，TTL 以分钟计。</li>
 * </ul>
 * 两者都按容量上限淘汰最久未使用的条目，过期条目不会再被返回。
 */
@Component
@Slf4j
public class RecommendationCache {

    static final String PREFERENCES = "preferences";
    static final String SCORE = "score";

    private final CacheClient cacheClient;
    private final Cache<String, SearchPreferences> preferencesCache;
    private final Cache<ScoreCacheKey, CachedScore> scoreCache;

    @Autowired
    public RecommendationCache(CacheClient cacheClient, CacheProperties properties, Ticker ticker) {
        this(cacheClient,
                properties.isEnabled() ? Caffeine.newBuilder()
                        .maximumSize(properties.getPreferencesMaxSize())
                        .expireAfterWrite(properties.getPreferencesTtlHours(), TimeUnit.HOURS)
                        .ticker(ticker)
                        .<String, SearchPreferences>build() : null,
                properties.isEnabled() ? Caffeine.newBuilder()
                        .maximumSize(properties.getScoreMaxSize())
                        .expireAfterWrite(properties.getScoreTtlMinutes(), TimeUnit.MINUTES)
                        .ticker(ticker)
                        .<ScoreCacheKey, CachedScore>build() : null);
        log.info("推荐缓存初始化: enabled={}, preferences(max={}, ttl={}h), score(max={}, ttl={}m)",
                properties.isEnabled(), properties.getPreferencesMaxSize(), properties.getPreferencesTtlHours(),
                properties.getScoreMaxSize(), properties.getScoreTtlMinutes());
    }

    RecommendationCache(CacheClient cacheClient,
                        Cache<String, SearchPreferences> preferencesCache,
                        Cache<ScoreCacheKey, CachedScore> scoreCache) {
        this.cacheClient = cacheClient;
        this.preferencesCache = preferencesCache;
        this.scoreCache = scoreCache;
    }

    public SearchPreferences normalizedPreferences(String rawFingerprint, Supplier<SearchPreferences> normalizer) {
        return cacheClient.queryWithFallback(PREFERENCES, preferencesCache, rawFingerprint, normalizer);
    }

    public CachedScore score(TripCandidate candidate, String preferenceFingerprint, long weightVersion,
                             Supplier<CachedScore> scorer) {
        ScoreCacheKey key = new ScoreCacheKey(candidate, preferenceFingerprint, weightVersion);
        return cacheClient.queryWithFallback(SCORE, scoreCache, key, scorer);
    }
}
