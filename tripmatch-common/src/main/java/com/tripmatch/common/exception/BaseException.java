package com.tripmatch.common.exception;

import com.tripmatch.common.result.ErrorCode;

/**
 * 统一的业务异常类型，由全局异常处理器转换为 {@code Result} 错误响应。
 * <p>子类对应推荐核心的错误分类（偏好不合法、Schema 不一致、训练数据不足、训练发散、缓存不可用）。</p>
 */
public class BaseException extends RuntimeException {

    private final ErrorCode errorCode;

    public BaseException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.errorCode = errorCode;
    }

    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Integer getCode() {
        return errorCode.getCode();
    }
}
