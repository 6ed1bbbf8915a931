package com.tripmatch.pojo.vo;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 一次训练任务的运行报告。
 */
@Data
public class TrainingRunVO {

    private String runId;

    /** DEPLOYED / DISCARDED */
    private String outcome;

    /** 丢弃原因：INSUFFICIENT_TRAINING_DATA / DIVERGENCE / VALIDATION_REGRESSION / SOURCE_ERROR / PUBLISH_FAILED */
    private String discardReason;

    private String message;

    /** 时间窗口内拉取到的原始记录数 */
    private Integer collected;

    /** 未通过有效性校验被过滤的记录数 */
    private Integer rejected;

    private Integer trainSize;

    private Integer validationSize;

    /** 每个 epoch 结束后的训练集 loss */
    private List<Double> trainLosses;

    /** 每个 epoch 结束后的验证集 loss */
    private List<Double> validationLosses;

    private Double candidateValidationLoss;

    private Double activeValidationLoss;

    private Double candidateAuc;

    private Double activeAuc;

    /** 训练起点（当时的线上版本） */
    private Long baseVersion;

    private Long deployedVersion;

    private LocalDateTime startTime;

    private LocalDateTime endTime;
}
