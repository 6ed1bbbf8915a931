package com.tripmatch.server.weights;

import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.WeightVector;

import java.util.EnumMap;
import java.util.Map;

/**
 * 冷启动权重：历史为空时作为版本 1 发布。
 * 数值沿用人工规则打分的量级（基础分 30，主题满分 25，国家匹配 15 ...），之后由训练任务持续修正。
 */
public final class DefaultWeights {

    private DefaultWeights() {
    }

    public static WeightVector initial() {
        Map<FeatureKey, Double> w = new EnumMap<>(FeatureKey.class);
        w.put(FeatureKey.BASE_SCORE, 30D);
        w.put(FeatureKey.THEME_MATCH_LEVEL, 12.5D);
        w.put(FeatureKey.THEME_MISMATCH, -15D);
        w.put(FeatureKey.TRIP_TYPE_MATCH, 10D);
        w.put(FeatureKey.DIFFICULTY_DELTA, -7.5D);
        w.put(FeatureKey.DURATION_DELTA, -2D);
        w.put(FeatureKey.BUDGET_RATIO, -6D);
        w.put(FeatureKey.STATUS_CODE, 7.5D);
        w.put(FeatureKey.DAYS_UNTIL_DEPARTURE, -7D);
        w.put(FeatureKey.GEO_MATCH_LEVEL, 7.5D);
        w.put(FeatureKey.DATE_MATCH_LEVEL, 4D);
        return WeightVector.draft(w);
    }
}
