package com.tripmatch.pojo.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 版本化的权重向量。发布后不可修改，新版本永远是新对象。
 * <p>训练产出的候选权重是草稿（version = 0），由 WeightStore 发布时分配正式版本号。</p>
 */
@EqualsAndHashCode
@ToString
public final class WeightVector {

    public static final long DRAFT_VERSION = 0L;

    private final long version;
    private final int schemaVersion;
    private final LocalDateTime createdAt;
    private final Map<FeatureKey, Double> weights;

    private WeightVector(long version, int schemaVersion, LocalDateTime createdAt, Map<FeatureKey, Double> weights) {
        this.version = version;
        this.schemaVersion = schemaVersion;
        this.createdAt = createdAt;
        EnumMap<FeatureKey, Double> copy = new EnumMap<>(FeatureKey.class);
        copy.putAll(weights);
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static WeightVector draft(Map<FeatureKey, Double> weights) {
        return new WeightVector(DRAFT_VERSION, FeatureKey.SCHEMA_VERSION, null, weights);
    }

    /**
     * 从持久化记录还原已发布的版本。
     */
    public static WeightVector restore(long version, int schemaVersion, LocalDateTime createdAt,
                                       Map<FeatureKey, Double> weights) {
        return new WeightVector(version, schemaVersion, createdAt, weights);
    }

    public WeightVector publishedAs(long newVersion, LocalDateTime publishedAt) {
        if (newVersion <= DRAFT_VERSION) {
            throw new IllegalArgumentException("published version must be positive: " + newVersion);
        }
        return new WeightVector(newVersion, schemaVersion, publishedAt, weights);
    }

    public boolean isDraft() {
        return version == DRAFT_VERSION;
    }

    public long getVersion() {
        return version;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    /**
     * @return 该 key 的权重；key 不存在时返回 null
     */
    public Double get(FeatureKey key) {
        return weights.get(key);
    }

    public Set<FeatureKey> keySet() {
        return weights.keySet();
    }

    public Map<FeatureKey, Double> asMap() {
        return weights;
    }
}
