package com.mobilebackup.importer.exception;

/**
 * 导入链路所有异常的基类，消息格式：[CODE] operation: message
 */
public class BackupImportException extends RuntimeException {

    private final String errorCode;
    private final String operation;

    public BackupImportException(String errorCode, String operation, String message) {
        super(String.format("[%s] %s: %s", errorCode, operation, message));
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public BackupImportException(String errorCode, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }
}
