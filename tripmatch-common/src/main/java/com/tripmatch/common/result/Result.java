package com.tripmatch.common.result;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result<T> {

    /** 0 表示成功，非 0 表示失败 */
    private Integer code;

    /** 提示信息 */
    private String msg;

    /** 业务数据 */
    private T data;

    public static <T> Result<T> success(T data) {
        return new Result<>(ErrorCode.SUCCESS.getCode(), ErrorCode.SUCCESS.getMsg(), data);
    }

    public static <T> Result<T> error(ErrorCode errorCode) {
        return error(errorCode.getCode(), errorCode.getMsg());
    }

    /**
     * 带具体原因的错误响应，msg 形如 "搜索偏好不合法: minDuration(14) > maxDuration(10)"。
     */
    public static <T> Result<T> error(ErrorCode errorCode, String detail) {
        if (detail == null || detail.isBlank() || detail.equals(errorCode.getMsg())) {
            return error(errorCode);
        }
        return error(errorCode.getCode(), errorCode.getMsg() + ": " + detail);
    }

    public static <T> Result<T> error(int code, String msg) {
        return new Result<>(code, msg, null);
    }
}
