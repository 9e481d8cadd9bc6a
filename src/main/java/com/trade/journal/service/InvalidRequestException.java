package com.trade.journal.service;

/**
 * 请求参数无效
 */
public class InvalidRequestException extends Exception {

    private final ErrorCode errorCode;

    public InvalidRequestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public InvalidRequestException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public enum ErrorCode {
        INVALID_DATE,                   // 日期格式错误
        INVALID_DATE_RANGE,             // 开始晚于结束
        UNKNOWN_PAIRING_METHOD,         // 配对方法不是 FIFO / LIFO
        CONCENTRATION_OUT_OF_RANGE,     // 集中度比例不在 [5, 30]
        INVALID_LIMIT,                  // 条数必须大于0
        INVALID_CSV                     // CSV 内容为空或缺少必需列
    }
}
