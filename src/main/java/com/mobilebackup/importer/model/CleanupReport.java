package com.mobilebackup.importer.model;

import lombok.Data;

@Data
public class CleanupReport {
    private int duplicateGroups;
    private int messagesRemoved;
    private int threadsRecomputed;
    private int emptyThreadsRemoved;
    private int orphanedMessagesRemoved;
    private long durationMs;
}
