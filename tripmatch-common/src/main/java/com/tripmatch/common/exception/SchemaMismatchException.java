package com.tripmatch.common.exception;

import com.tripmatch.common.result.ErrorCode;

/**
 * 特征向量与权重向量的 key 集合或 Schema 版本不一致，仅使当前请求失败，需线下修复部署。
 */
public class SchemaMismatchException extends BaseException {

    public SchemaMismatchException(String message) {
        super(ErrorCode.SCHEMA_MISMATCH, message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(ErrorCode.SCHEMA_MISMATCH, message, cause);
    }
}
