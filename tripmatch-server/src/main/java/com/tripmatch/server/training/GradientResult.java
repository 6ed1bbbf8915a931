package com.tripmatch.server.training;

import com.tripmatch.pojo.model.FeatureKey;
import lombok.Value;

import java.util.Map;

/**
 * 一个 batch 上的梯度与（更新前的）加权交叉熵 loss。
 */
@Value
public class GradientResult {

    Map<FeatureKey, Double> gradient;

    double loss;
}
