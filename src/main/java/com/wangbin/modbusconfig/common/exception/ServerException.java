package com.wangbin.modbusconfig.common.exception;

/**
 * 未归类的服务端错误，保留原始异常信息
 */
public class ServerException extends BusinessException {

    public ServerException(String message, Throwable cause) {
        super(500, message != null ? message : "Server error", cause);
    }

    public static ServerException wrap(String action, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        return new ServerException(action + ": " + detail, cause);
    }
}
