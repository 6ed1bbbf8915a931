package com.tripmatch.common.exception;

import com.tripmatch.common.result.ErrorCode;

/**
 * 偏好不合法，直接返回调用方，不重试。
 */
public class InvalidPreferencesException extends BaseException {

    public InvalidPreferencesException(String message) {
        super(ErrorCode.INVALID_PREFERENCES, message);
    }

    public InvalidPreferencesException(String message, Throwable cause) {
        super(ErrorCode.INVALID_PREFERENCES, message, cause);
    }
}
