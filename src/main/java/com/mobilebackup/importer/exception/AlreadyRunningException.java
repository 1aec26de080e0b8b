package com.mobilebackup.importer.exception;

import com.mobilebackup.importer.model.RecordCategory;

public class AlreadyRunningException extends SyncRejectedException {

    public AlreadyRunningException(RecordCategory category) {
        super("ALREADY_RUNNING", category,
                String.format("Sync for %s is already running", category.key()));
    }
}
