package com.mobilebackup.importer.model;

import lombok.Data;

import java.time.Instant;

/**
 * Manifest.db 里 Preferences 表读出来的备份元信息，一次导入只读一次。
 */
@Data
public class BackupManifest {
    private String version;
    private Instant createdAt;
    private String deviceId;
    private String deviceName;
    private String osVersion;
    private boolean encrypted;
}
