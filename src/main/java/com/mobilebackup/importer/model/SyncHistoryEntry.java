package com.mobilebackup.importer.model;

import lombok.Data;

import java.time.Instant;

@Data
public class SyncHistoryEntry {
    private long id;
    private RecordCategory category;
    private String backupPath;
    private String status;        // SUCCESS / PARTIAL / FAILED / CANCELLED
    private Instant startedAt;
    private Instant finishedAt;
    private int imported;
    private int skipped;
    private int errors;
    private String errorMessage;
}
