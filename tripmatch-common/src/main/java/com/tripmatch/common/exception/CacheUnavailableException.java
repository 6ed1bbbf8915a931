package com.tripmatch.common.exception;

import com.tripmatch.common.result.ErrorCode;

/**
 * 缓存后端异常，仅在缓存层内部使用，调用方回退到直接计算。
 */
public class CacheUnavailableException extends BaseException {

    public CacheUnavailableException(String message) {
        super(ErrorCode.CACHE_UNAVAILABLE, message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(ErrorCode.CACHE_UNAVAILABLE, message, cause);
    }
}
