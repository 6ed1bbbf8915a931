package com.tripmatch.server.training;

import com.tripmatch.pojo.model.TrainingExample;
import lombok.Value;

import java.util.List;

/**
 * 一次训练使用的数据：按会话稳定划分的训练集 / 验证集，以及拉取与过滤的计数。
 */
@Value
public class TrainingDataset {

    int collected;

    int rejected;

    List<TrainingExample> train;

    List<TrainingExample> validation;

    public int usable() {
        return train.size() + validation.size();
    }
}
