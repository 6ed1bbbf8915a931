package com.tripmatch.pojo.model;

import lombok.Value;

import java.util.Comparator;

/**
 * 打分结果：候选 + 特征向量 + 得分 + 使用的权重版本。每次请求临时生成，不落库。
 */
@Value
public class ScoredTrip {

    /**
     * 排序规则：得分降序，得分完全相同时按 tripId 升序，保证相同输入的输出顺序稳定。
     */
    public static final Comparator<ScoredTrip> RANKING = Comparator
            .comparingDouble(ScoredTrip::getScore).reversed()
            .thenComparingLong(ScoredTrip::getTripId);

    TripCandidate trip;

    FeatureVector features;

    double score;

    long weightVersion;

    public long getTripId() {
        return trip.getTripId();
    }

    /**
     * @return true 表示当前结果排在 other 之前
     */
    public boolean ranksBefore(ScoredTrip other) {
        return RANKING.compare(this, other) < 0;
    }
}
