package com.tripmatch.pojo.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * 不可变的特征向量：FeatureKey -> 数值，附带生成它的特征 Schema 版本。
 * <p>这里不校验 key 是否齐全，是否与权重向量一致由打分时统一判定。</p>
 */
@EqualsAndHashCode
@ToString
public final class FeatureVector {

    private final int schemaVersion;
    private final Map<FeatureKey, Double> values;

    private FeatureVector(int schemaVersion, Map<FeatureKey, Double> values) {
        this.schemaVersion = schemaVersion;
        EnumMap<FeatureKey, Double> copy = new EnumMap<>(FeatureKey.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    public static FeatureVector of(Map<FeatureKey, Double> values) {
        return new FeatureVector(FeatureKey.SCHEMA_VERSION, values);
    }

    public static FeatureVector of(int schemaVersion, Map<FeatureKey, Double> values) {
        return new FeatureVector(schemaVersion, values);
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    /**
     * @return 该 key 的取值；key 不存在时返回 null
     */
    public Double get(FeatureKey key) {
        return values.get(key);
    }

    public Set<FeatureKey> keySet() {
        return values.keySet();
    }

    public Map<FeatureKey, Double> asMap() {
        return values;
    }
}
