package com.tripmatch.server.training;

/**
 * 候选权重被丢弃的原因。
 */
public enum DiscardReason {
    INSUFFICIENT_TRAINING_DATA,
    DIVERGENCE,
    VALIDATION_REGRESSION,
    SOURCE_ERROR,
    /** 线上权重与当前特征 Schema 不一致，无法作为训练起点 */
    SCHEMA_MISMATCH,
    PUBLISH_FAILED
}
