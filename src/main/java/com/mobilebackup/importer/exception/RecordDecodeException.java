package com.mobilebackup.importer.exception;

import com.mobilebackup.importer.model.RecordCategory;

/**
 * 单行记录解码失败。只跳过这一行，不影响整个提取器。
 */
public class RecordDecodeException extends BackupImportException {

    public RecordDecodeException(RecordCategory category, String rowRef, Throwable cause) {
        super("RECORD_DECODE_ERROR", "decode" + capitalize(category.key()),
                String.format("Failed to decode %s row %s: %s", category.key(), rowRef,
                        cause == null ? "unknown" : cause.getMessage()), cause);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
