package com.mobilebackup.importer.exception;

/**
 * 备份已加密。不做任何解密尝试，直接拒绝。
 */
public class BackupEncryptedException extends BackupImportException {

    public BackupEncryptedException(String deviceName) {
        super("BACKUP_ENCRYPTED", "openContainer",
                String.format("Backup of device '%s' is encrypted and cannot be imported", deviceName));
    }
}
