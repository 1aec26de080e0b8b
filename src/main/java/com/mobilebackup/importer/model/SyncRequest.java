package com.mobilebackup.importer.model;

import lombok.Data;

@Data
public class SyncRequest {
    /** 备份根目录（含 Manifest.db） */
    private String backupPath;
}
