package com.tripmatch.server.cache;

import com.tripmatch.pojo.model.TripCandidate;
import lombok.Value;

/**
 * 行程得分缓存 key。
 * <p>候选按值参与比较（价格、状态、时长、难度、目的地、主题、类型、出发日期都在内），
 * 同一 tripId 的库存信息变化后不会命中旧得分；包含权重版本，发布或回滚权重后旧版本算出的得分也不会被新请求命中。</p>
 */
@Value
public class ScoreCacheKey {

    TripCandidate candidate;

    String preferenceFingerprint;

    long weightVersion;
}
