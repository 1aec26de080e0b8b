package com.mobilebackup.importer.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次整包同步（联系人 + 消息 + 通话）的汇总。
 */
@Data
public class SyncRunReport {
    private String backupPath;
    private BackupManifest manifest;
    private Map<RecordCategory, ImportResult> results = new LinkedHashMap<>();
    /** 被协调器拒绝的类别及原因（AlreadyRunning / CooldownActive） */
    private Map<RecordCategory, String> rejected = new LinkedHashMap<>();
    private List<String> errors = new ArrayList<>();

    public int totalImported() {
        return results.values().stream().mapToInt(ImportResult::getImported).sum();
    }
}
