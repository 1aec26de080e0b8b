package com.mobilebackup.importer.controller;

import com.mobilebackup.importer.exception.AlreadyRunningException;
import com.mobilebackup.importer.exception.BackupEncryptedException;
import com.mobilebackup.importer.exception.BackupImportException;
import com.mobilebackup.importer.exception.CooldownActiveException;
import com.mobilebackup.importer.exception.ManifestUnavailableException;
import com.mobilebackup.importer.exception.ThreadNotFoundException;
import com.mobilebackup.importer.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 异常 → HTTP 状态码：
 * 409 正在同步 / 429 冷却中 / 422 备份不可用或已加密 / 404 会话不存在 / 400 参数错误
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(AlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> alreadyRunning(AlreadyRunningException e) {
        return body(HttpStatus.CONFLICT, e, null);
    }

    @ExceptionHandler(CooldownActiveException.class)
    public ResponseEntity<ErrorResponse> cooldown(CooldownActiveException e) {
        long seconds = (long) Math.ceil(e.getRemaining().toMillis() / 1000.0);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), seconds));
    }

    @ExceptionHandler({ManifestUnavailableException.class, BackupEncryptedException.class})
    public ResponseEntity<ErrorResponse> unusableBackup(BackupImportException e) {
        log.warn("备份不可导入: {}", e.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, e, null);
    }

    @ExceptionHandler(ThreadNotFoundException.class)
    public ResponseEntity<ErrorResponse> threadNotFound(ThreadNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage(), null));
    }

    @ExceptionHandler(BackupImportException.class)
    public ResponseEntity<ErrorResponse> other(BackupImportException e) {
        log.error("导入失败: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e, null);
    }

    private ResponseEntity<ErrorResponse> body(HttpStatus status, BackupImportException e, Long retryAfter) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage(), retryAfter));
    }
}
