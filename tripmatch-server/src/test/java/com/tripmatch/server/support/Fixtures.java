package com.tripmatch.server.support;

import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.FeatureVector;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.WeightVector;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * 测试用的权重 / 特征 / 偏好构造方法，未指定的 key 一律补 0。
 */
public final class Fixtures {

    public static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    private Fixtures() {
    }

    public static Map<FeatureKey, Double> zeros() {
        Map<FeatureKey, Double> m = new EnumMap<>(FeatureKey.class);
        for (FeatureKey key : FeatureKey.values()) {
            m.put(key, 0D);
        }
        return m;
    }

    public static Map<FeatureKey, Double> with(Object... keyValues) {
        Map<FeatureKey, Double> m = zeros();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((FeatureKey) keyValues[i], ((Number) keyValues[i + 1]).doubleValue());
        }
        return m;
    }

    public static WeightVector weights(long version, Object... keyValues) {
        return WeightVector.restore(version, FeatureKey.SCHEMA_VERSION, NOW, with(keyValues));
    }

    public static FeatureVector features(Object... keyValues) {
        return FeatureVector.of(with(keyValues));
    }

    public static SearchPreferences.SearchPreferencesBuilder preferences() {
        return SearchPreferences.builder()
                .countryIds(Collections.unmodifiableSortedSet(new TreeSet<>()))
                .continents(Collections.unmodifiableSortedSet(new TreeSet<>()))
                .themeIds(Collections.unmodifiableSortedSet(new TreeSet<>()))
                .minDuration(1)
                .maxDuration(365)
                .fingerprint("test");
    }
}
