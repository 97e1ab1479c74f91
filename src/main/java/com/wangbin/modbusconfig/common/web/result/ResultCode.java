package com.wangbin.modbusconfig.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),
    NOT_FOUND(404, "资源不存在"),
    CONFLICT(409, "资源冲突"),
    UNPROCESSABLE(422, "无法处理的请求内容"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_NOT_FOUND(1001, "数据不存在"),
    DATA_EXISTS(1002, "数据已存在"),

    // 配置相关错误
    CONFIG_ERROR(3000, "配置错误"),
    CONFIG_INVALID(3002, "配置无效"),
    CONFIG_FORMAT_MISMATCH(3004, "配置格式不匹配"),
    CONFIG_PROCESS_ERROR(3005, "配置处理错误"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),

    // 其他错误
    UNKNOWN_ERROR(9999, "未知错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 根据code获取枚举
     */
    public static ResultCode fromCode(int code) {
        for (ResultCode resultCode : values()) {
            if (resultCode.getCode() == code) {
                return resultCode;
            }
        }
        return UNKNOWN_ERROR;
    }

    /**
     * 判断是否为服务器错误
     */
    public boolean isServerError() {
        return (code >= 500 && code < 600) || (code >= 5000 && code < 6000);
    }
}
