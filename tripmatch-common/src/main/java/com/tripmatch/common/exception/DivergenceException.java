package com.tripmatch.common.exception;

import com.tripmatch.common.result.ErrorCode;

/**
 * 梯度更新后出现非有限值（NaN/Infinity），本次训练丢弃，线上权重保持不变。
 */
public class DivergenceException extends BaseException {

    public DivergenceException(String message) {
        super(ErrorCode.DIVERGENCE, message);
    }

    public DivergenceException(String message, Throwable cause) {
        super(ErrorCode.DIVERGENCE, message, cause);
    }
}
