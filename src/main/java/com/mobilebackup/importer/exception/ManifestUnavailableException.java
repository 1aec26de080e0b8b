package com.mobilebackup.importer.exception;

import java.nio.file.Path;

/**
 * Manifest 索引缺失或无法读取。对整次导入是致命错误。
 */
public class ManifestUnavailableException extends BackupImportException {

    public ManifestUnavailableException(Path manifest, String details) {
        super("MANIFEST_UNAVAILABLE", "openContainer",
                String.format("Manifest unavailable at %s: %s", manifest, details));
    }

    public ManifestUnavailableException(Path manifest, Throwable cause) {
        super("MANIFEST_UNAVAILABLE", "openContainer",
                String.format("Manifest unreadable at %s", manifest), cause);
    }
}
