package com.tripmatch.server.handler;

import com.tripmatch.common.exception.BaseException;
import com.tripmatch.common.result.ErrorCode;
import com.tripmatch.common.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 调用方可修正的错误（4xxx）只打 warn；系统错误（5xxx）打 error 并带堆栈。
     */
    @ExceptionHandler(BaseException.class)
    public Result<Void> handleBaseException(BaseException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.isCallerFixable()) {
            log.warn("业务异常: code={}, msg={}", errorCode.getCode(), ex.getMessage());
        } else {
            log.error("系统异常: code={}, msg={}", errorCode.getCode(), ex.getMessage(), ex);
        }
        return Result.error(errorCode, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result<Void> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("请求体解析失败: {}", ex.getMessage());
        return Result.error(ErrorCode.INVALID_PREFERENCES, "请求体格式错误");
    }

    @ExceptionHandler(Exception.class)
    public Result<Void> handleOtherException(Exception ex) {
        log.error("系统异常", ex);
        return Result.error(ErrorCode.COMMON_ERROR.getCode(), "系统异常，请稍后重试");
    }
}
