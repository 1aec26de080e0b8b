package com.mobilebackup.importer.exception;

import com.mobilebackup.importer.model.RecordCategory;

/**
 * 同步协调器同步拒绝请求。不会自动重试。
 */
public abstract class SyncRejectedException extends BackupImportException {

    private final RecordCategory category;

    protected SyncRejectedException(String errorCode, RecordCategory category, String message) {
        super(errorCode, "startSync", message);
        this.category = category;
    }

    public RecordCategory getCategory() {
        return category;
    }
}
