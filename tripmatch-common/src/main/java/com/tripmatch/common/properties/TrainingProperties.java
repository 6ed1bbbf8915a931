package com.tripmatch.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 权重训练任务配置。
 * Weight training job configuration (window, epochs, learning rate, promotion tolerance).
 */
@Data
@ConfigurationProperties(prefix = "tripmatch.training")
public class TrainingProperties {

    /** 是否启用定时训练；手动触发不受此开关影响 */
    private boolean enabled = true;

    /** 定时训练 cron，默认每天 03:00 */
    private String cron = "0 0 3 * * ?";

    /** 训练样本回溯窗口（天） */
    private int windowDays = 30;

    /** 有效样本数下限，低于该值直接丢弃本次训练 */
    private int minExamples = 500;

    private int epochs = 50;

    /** 学习率：单次训练内固定，不参与学习 */
    private double learningRate = 0.05D;

    /** 验证集比例（百分比），按 sessionId 稳定哈希划分 */
    private int validationPercent = 20;

    /**
     * 晋升容差：候选权重的验证集 loss 允许比线上权重高出的最大值。
     * 0 表示不允许任何回退。
     */
    private double promotionTolerance = 0.0D;

    /** 停留时长超过该值（秒）视为异常样本 */
    private int maxDwellSeconds = 4 * 3600;

    /** 是否使用 Redis 租约保证多实例下只有一个训练任务 */
    private boolean distributedLock = true;

    /** Redis 训练锁租约（秒），需大于一次训练的最长耗时 */
    private long lockLeaseSeconds = 1800L;
}
