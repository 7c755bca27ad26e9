package com.convsync.common.web;

import com.convsync.common.api.ApiCodes;
import com.convsync.common.api.Result;
import com.convsync.domain.AccessDeniedException;
import com.convsync.log.ConversationLogException;
import com.convsync.log.PublishInProgressException;
import com.convsync.sync.SyncStateStoreException;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理：把常见异常翻译为统一的 Result JSON，同时设置对应的 HTTP 状态码。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getAllErrors().isEmpty()
            ? "invalid_request"
            : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Result<Void>> handleMissingParam(MissingServletRequestParameterException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, "missing_" + e.getParameterName()));
    }

    /**
     * 参数/业务校验失败（service 层用 IllegalArgumentException 表达）。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "bad_request" : e.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler(JwtException.class)
    public ResponseEntity<Result<Void>> handleJwt(JwtException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "invalid_token" : e.getMessage();
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Result.fail(ApiCodes.UNAUTHORIZED, msg));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Result<Void>> handleForbidden(AccessDeniedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Result.fail(ApiCodes.FORBIDDEN, "forbidden"));
    }

    @ExceptionHandler(PublishInProgressException.class)
    public ResponseEntity<Result<Void>> handleInProgress(PublishInProgressException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Result.fail(ApiCodes.CONFLICT, "publish_in_progress"));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Result<Void>> handleConflict(IllegalStateException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "conflict" : e.getMessage();
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Result.fail(ApiCodes.CONFLICT, msg));
    }

    /**
     * 日志/游标存储不可用：客户端可退避重试。
     */
    @ExceptionHandler({ConversationLogException.class, SyncStateStoreException.class})
    public ResponseEntity<Result<Void>> handleUnavailable(RuntimeException e) {
        log.warn("storage unavailable: err={}", e.toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Result.fail(ApiCodes.SERVICE_UNAVAILABLE, "storage_unavailable"));
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled api error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
