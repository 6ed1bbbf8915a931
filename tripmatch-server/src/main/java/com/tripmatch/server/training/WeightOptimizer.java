package com.tripmatch.server.training;

import com.tripmatch.common.exception.DivergenceException;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.TrainingExample;
import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.server.recommend.ScoringEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 带位置偏差修正的逻辑回归优化器。
 *
 * <p>p = sigmoid(w·x)，样本权重 pw = 1 / (1 + position)，
 * loss = mean(pw × −[y·ln p + (1−y)·ln(1−p)])，p 截断到 [1e-12, 1 − 1e-12]。
 * 梯度 g = mean(pw × (p − y) × x)，更新 w' = w − lr × g，更新后 BASE_SCORE 权重不小于 0。</p>
 *
 * <p>无状态，同样的输入总是得到同样的输出。</p>
 */
@Component
@RequiredArgsConstructor
public class WeightOptimizer {

    static final double P_MIN = 1e-12;
    static final double P_MAX = 1 - 1e-12;

    private final ScoringEngine scoringEngine;

    /**
     * @return 梯度与当前权重在该 batch 上的 loss；空 batch 返回零梯度与 0 loss
     * @throws DivergenceException 梯度或 loss 出现 NaN / Infinity
     */
    public GradientResult computeGradient(WeightVector weights, List<TrainingExample> batch) {
        Map<FeatureKey, Double> gradient = new EnumMap<>(FeatureKey.class);
        for (FeatureKey key : weights.keySet()) {
            gradient.put(key, 0D);
        }
        if (batch.isEmpty()) {
            return new GradientResult(Collections.unmodifiableMap(gradient), 0D);
        }

        double lossSum = 0D;
        for (TrainingExample example : batch) {
            double p = predict(weights, example);
            double y = example.label();
            double pw = example.positionWeight();
            lossSum += pw * crossEntropy(p, y);
            double residual = pw * (p - y);
            for (Map.Entry<FeatureKey, Double> e : example.getFeatures().asMap().entrySet()) {
                gradient.merge(e.getKey(), residual * e.getValue(), Double::sum);
            }
        }
        int n = batch.size();
        gradient.replaceAll((key, sum) -> sum / n);
        double loss = lossSum / n;

        for (Map.Entry<FeatureKey, Double> e : gradient.entrySet()) {
            if (!Double.isFinite(e.getValue())) {
                throw new DivergenceException("non-finite gradient for " + e.getKey() + ": " + e.getValue());
            }
        }
        if (!Double.isFinite(loss)) {
            throw new DivergenceException("non-finite loss: " + loss);
        }
        return new GradientResult(Collections.unmodifiableMap(gradient), loss);
    }

    /**
     * @return 更新后的草稿权重；入参不会被修改
     * @throws DivergenceException 任一更新后的权重不是有限值
     */
    public WeightVector applyUpdate(WeightVector weights, Map<FeatureKey, Double> gradient, double learningRate) {
        Map<FeatureKey, Double> updated = new EnumMap<>(FeatureKey.class);
        for (Map.Entry<FeatureKey, Double> e : weights.asMap().entrySet()) {
            double g = gradient.getOrDefault(e.getKey(), 0D);
            double w = e.getValue() - learningRate * g;
            if (!Double.isFinite(w)) {
                throw new DivergenceException("non-finite weight for " + e.getKey() + " after update: " + w);
            }
            if (e.getKey() == FeatureKey.BASE_SCORE) {
                w = Math.max(0D, w);
            }
            updated.put(e.getKey(), w);
        }
        return WeightVector.draft(updated);
    }

    /**
     * 位置加权交叉熵，空 batch 为 0。
     */
    public double loss(WeightVector weights, List<TrainingExample> batch) {
        if (batch.isEmpty()) {
            return 0D;
        }
        double sum = 0D;
        for (TrainingExample example : batch) {
            sum += example.positionWeight() * crossEntropy(predict(weights, example), example.label());
        }
        double loss = sum / batch.size();
        if (!Double.isFinite(loss)) {
            throw new DivergenceException("non-finite loss: " + loss);
        }
        return loss;
    }

    double predict(WeightVector weights, TrainingExample example) {
        return sigmoid(scoringEngine.score(example.getFeatures(), weights));
    }

    static double sigmoid(double z) {
        return 1D / (1D + Math.exp(-z));
    }

    private static double crossEntropy(double p, double y) {
        double clipped = Math.min(P_MAX, Math.max(P_MIN, p));
        return -(y * Math.log(clipped) + (1D - y) * Math.log(1D - clipped));
    }
}
