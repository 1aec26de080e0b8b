package com.mobilebackup.importer.model;

/** 单个类别的同步状态机：IDLE → RUNNING → COOLDOWN_WAIT → IDLE */
public enum SyncState {
    IDLE,
    RUNNING,
    COOLDOWN_WAIT
}
