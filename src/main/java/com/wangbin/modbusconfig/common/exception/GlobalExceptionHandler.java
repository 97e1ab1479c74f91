package com.wangbin.modbusconfig.common.exception;

import com.wangbin.modbusconfig.common.web.result.ApiResult;
import com.wangbin.modbusconfig.common.web.result.ResultCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 全局异常处理器
 *
 * 响应体 code 使用与 HTTP 状态一致的结果码，原始业务码放在 extra.errorCode 中
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 方言不匹配
     */
    @ExceptionHandler(ConfigFormatMismatchException.class)
    public ResponseEntity<ApiResult<?>> handleFormatMismatch(ConfigFormatMismatchException e, HttpServletRequest request) {
        log.error("配置格式不匹配: 期望 {}，检测到 {}", e.getExpected().getValue(), e.getDetected().getValue());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ResultCode.UNPROCESSABLE, e);
    }

    /**
     * 配置文件格式错误、点位处理错误
     */
    @ExceptionHandler(ModbusConfigException.class)
    public ResponseEntity<ApiResult<?>> handleConfigException(ModbusConfigException e, HttpServletRequest request) {
        log.error("配置异常: {} - {}", e.getCode(), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, ResultCode.BAD_REQUEST, e);
    }

    @ExceptionHandler(DuplicateException.class)
    public ResponseEntity<ApiResult<?>> handleDuplicate(DuplicateException e, HttpServletRequest request) {
        log.error("数据冲突: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, ResultCode.CONFLICT, e);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResult<?>> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        log.error("资源不存在: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, ResultCode.NOT_FOUND, e);
    }

    /**
     * 处理业务异常，服务端错误码返回 500，其余按请求错误处理
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResult<?>> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        ResultCode resultCode = ResultCode.fromCode(e.getCode());
        if (e instanceof ServerException || resultCode.isServerError()) {
            return build(HttpStatus.INTERNAL_SERVER_ERROR, ResultCode.SYSTEM_ERROR, e);
        }
        return build(HttpStatus.BAD_REQUEST, ResultCode.BAD_REQUEST, e);
    }

    /**
     * 缺少请求参数或上传文件
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ApiResult<?>> handleMissingParameter(Exception e, HttpServletRequest request) {
        log.error("请求参数缺失: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResult.error(ResultCode.PARAM_ERROR.getCode(), e.getMessage()));
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResult<?>> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}", request.getRequestURI(), request.getMethod(), e.getMessage(), e);

        // 生产环境隐藏详细错误信息
        String message = "系统内部错误，请联系管理员";
        if (isDevEnvironment()) {
            message = e.getMessage();
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), message));
    }

    private ResponseEntity<ApiResult<?>> build(HttpStatus status, ResultCode resultCode, BusinessException e) {
        ApiResult<Object> result = ApiResult.error(resultCode.getCode(), e.getMessage());
        result.addExtra("errorCode", e.getCode());
        return ResponseEntity.status(status).body(result);
    }

    /**
     * 判断是否为开发环境
     */
    private boolean isDevEnvironment() {
        String activeProfile = System.getProperty("spring.profiles.active");
        return "dev".equals(activeProfile) || "test".equals(activeProfile);
    }
}
