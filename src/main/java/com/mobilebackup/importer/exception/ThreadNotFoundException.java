package com.mobilebackup.importer.exception;

public class ThreadNotFoundException extends BackupImportException {

    public ThreadNotFoundException(String threadId) {
        super("THREAD_NOT_FOUND", "findThread", "Conversation thread not found: " + threadId);
    }
}
