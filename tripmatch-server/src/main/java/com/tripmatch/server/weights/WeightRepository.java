package com.tripmatch.server.weights;

import com.tripmatch.pojo.model.WeightVector;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 权重历史的持久化：版本表与激活日志都只追加。
 */
public interface WeightRepository {

    /**
     * @return 全部已发布版本，按版本号升序
     */
    List<WeightVector> loadAll();

    /**
     * @return 最近一次激活的版本号，没有激活记录时返回 null
     */
    Long loadActiveVersion();

    void save(WeightVector published, String source);

    void recordActivation(long version, String reason, LocalDateTime activateTime);
}
