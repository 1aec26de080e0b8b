package com.mobilebackup.importer.outbound;

/**
 * 外部发送失败。受检异常，调用方必须决定是否记录失败结果。
 */
public class SendException extends Exception {

    public SendException(String message) {
        super(message);
    }

    public SendException(String message, Throwable cause) {
        super(message, cause);
    }
}
