package com.tripmatch.server.recommend;

import com.tripmatch.common.exception.SchemaMismatchException;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.FeatureVector;
import com.tripmatch.pojo.model.WeightVector;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * 线性打分：score = Σ weight(k) × feature(k)。
 * <p>无状态，可被任意多个线程针对同一个不可变 WeightVector 并发调用。</p>
 */
@Component
public class ScoringEngine {

    /**
     * @throws SchemaMismatchException 特征向量与权重向量的 key 集合或 Schema 版本不一致（不做补零）
     */
    public double score(FeatureVector features, WeightVector weights) {
        assertSameSchema(features, weights);
        double score = 0D;
        // 固定按枚举顺序累加，保证浮点结果与调用顺序无关
        for (FeatureKey key : FeatureKey.values()) {
            Double x = features.get(key);
            if (x != null) {
                score += weights.get(key) * x;
            }
        }
        return score;
    }

    /**
     * 各特征的得分贡献，用于推荐理由展示。
     */
    public Map<FeatureKey, Double> contributions(FeatureVector features, WeightVector weights) {
        assertSameSchema(features, weights);
        Map<FeatureKey, Double> result = new EnumMap<>(FeatureKey.class);
        for (Map.Entry<FeatureKey, Double> e : features.asMap().entrySet()) {
            result.put(e.getKey(), weights.get(e.getKey()) * e.getValue());
        }
        return result;
    }

    private static void assertSameSchema(FeatureVector features, WeightVector weights) {
        if (features.getSchemaVersion() != weights.getSchemaVersion()
                || !features.keySet().equals(weights.keySet())) {
            throw new SchemaMismatchException(String.format(
                    "feature schema v%d keys=%s, weight v%d schema v%d keys=%s",
                    features.getSchemaVersion(), features.keySet(),
                    weights.getVersion(), weights.getSchemaVersion(), weights.keySet()));
        }
    }
}
