package com.tripmatch.common.exception;

import com.tripmatch.common.result.ErrorCode;

/**
 * 可用训练样本低于配置下限，本次训练直接丢弃。
 */
public class InsufficientTrainingDataException extends BaseException {

    public InsufficientTrainingDataException(String message) {
        super(ErrorCode.INSUFFICIENT_TRAINING_DATA, message);
    }

    public InsufficientTrainingDataException(String message, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_TRAINING_DATA, message, cause);
    }
}
