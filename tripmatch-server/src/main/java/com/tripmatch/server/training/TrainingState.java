package com.tripmatch.server.training;

/**
 * 训练任务状态机：IDLE -> COLLECTING -> TRAINING -> VALIDATING -> DEPLOYING | DISCARDING -> IDLE。
 */
public enum TrainingState {
    IDLE,
    COLLECTING,
    TRAINING,
    VALIDATING,
    DEPLOYING,
    DISCARDING
}
