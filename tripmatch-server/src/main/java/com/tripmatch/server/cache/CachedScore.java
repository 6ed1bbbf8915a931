package com.tripmatch.server.cache;

import com.tripmatch.pojo.model.FeatureVector;
import lombok.Value;

/**
 * 得分缓存的值：只保存特征向量与得分，不保存候选本身。
 * 命中后由调用方用本次请求传入的候选组装 ScoredTrip。
 */
@Value
public class CachedScore {

    FeatureVector features;

    double score;
}
