package com.tripmatch.common.result;

/**
 * 错误码枚举。
 * <p>4xxx：调用方可修正的问题（参数、偏好不合法等）；5xxx：系统侧问题（Schema 不一致、训练失败等）。</p>
 */
public enum ErrorCode {

    SUCCESS(0, "ok"),

    /** 通用业务错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error"),

    /** 搜索偏好不合法（如 minDuration > maxDuration） */
    INVALID_PREFERENCES(4001, "搜索偏好不合法"),

    /** 请求的 Top-K 数量不合法 */
    INVALID_K(4002, "返回数量 k 不合法"),

    /** 回滚目标版本不存在 */
    WEIGHT_VERSION_NOT_FOUND(4041, "权重版本不存在"),

    /** 回滚目标版本已超过保留期 */
    WEIGHT_VERSION_EXPIRED(4042, "权重版本已超过保留期，不可回滚"),

    /** 已有训练任务在运行 */
    TRAINING_ALREADY_RUNNING(4091, "已有训练任务在运行"),

    /** 特征向量与权重向量的 key 集合不一致 */
    SCHEMA_MISMATCH(5001, "特征 Schema 与权重 Schema 不一致"),

    /** 训练数据不足 */
    INSUFFICIENT_TRAINING_DATA(5002, "训练数据不足"),

    /** 梯度更新出现数值发散 */
    DIVERGENCE(5003, "训练发散"),

    /** 缓存后端不可用（内部使用，不对外暴露） */
    CACHE_UNAVAILABLE(5004, "缓存不可用"),

    /** 排序请求超时或被取消 */
    RANK_ABORTED(5005, "排序请求超时或被取消"),

    /** 权重持久化失败 */
    WEIGHT_PERSIST_FAILED(5006, "权重持久化失败");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }

    /**
     * 4xxx 段表示调用方可修正的错误。
     */
    public boolean isCallerFixable() {
        return code >= 4000 && code < 5000;
    }
}
