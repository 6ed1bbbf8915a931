package com.tripmatch.server.training;

import com.tripmatch.pojo.entity.RecommendationImpression;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 训练样本来源：按时间窗口只读地拉取曝光日志原始记录，有效性校验由 {@link TrainingDataPreparer} 负责。
 */
public interface TrainingExampleSource {

    /**
     * @return [from, to) 窗口内的原始曝光记录
     */
    List<RecommendationImpression> fetchWindow(LocalDateTime from, LocalDateTime to);
}
