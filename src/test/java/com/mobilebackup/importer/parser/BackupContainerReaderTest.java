package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.config.ImporterProperties;
import com.mobilebackup.importer.exception.BackupEncryptedException;
import com.mobilebackup.importer.exception.ManifestUnavailableException;
import com.mobilebackup.importer.support.BackupFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 备份索引读取：manifest 解析、后缀查找、致命错误。
 */
class BackupContainerReaderTest {

    @TempDir
    Path root;

    private final BackupContainerReader reader = new BackupContainerReader(new ImporterProperties());

    @Test
    void readsManifestPreferences() {
        BackupFixture.create(root);

        try (BackupContainer container = reader.open(root)) {
            assertEquals("Test iPhone", container.getManifest().getDeviceName());
            assertEquals("17.4", container.getManifest().getOsVersion());
            assertEquals("00008030-TEST", container.getManifest().getDeviceId());
            assertEquals(Instant.parse("2024-03-01T10:15:30Z"), container.getManifest().getCreatedAt());
            assertFalse(container.getManifest().isEncrypted());
        }
    }

    @Test
    void numericDateIsVendorSeconds() {
        BackupFixture.create(root).preference("Date", 86400);

        try (BackupContainer container = reader.open(root)) {
            assertEquals(Instant.parse("2001-01-02T00:00:00Z"), container.getManifest().getCreatedAt());
        }
    }

    @Test
    void encryptedBackupIsRejected() {
        BackupFixture.create(root, true);

        BackupEncryptedException e = assertThrows(BackupEncryptedException.class, () -> reader.open(root));
        assertEquals("BACKUP_ENCRYPTED", e.getErrorCode());
    }

    @Test
    void encryptedAsTextIsRejected() {
        BackupFixture.create(root).preference("IsEncrypted", "true");

        assertThrows(BackupEncryptedException.class, () -> reader.open(root));
    }

    @Test
    void missingManifestIsFatal() {
        ManifestUnavailableException e = assertThrows(ManifestUnavailableException.class, () -> reader.open(root));
        assertEquals("MANIFEST_UNAVAILABLE", e.getErrorCode());
    }

    @Test
    void garbageManifestIsFatal() throws Exception {
        Files.writeString(root.resolve("Manifest.db"), "definitely not a database, just some text padding it out");

        assertThrows(ManifestUnavailableException.class, () -> reader.open(root));
    }

    @Test
    void manifestWithoutTablesIsFatal() {
        BackupFixture.sql(root.resolve("Manifest.db"), "CREATE TABLE Something (x INTEGER)");

        assertThrows(ManifestUnavailableException.class, () -> reader.open(root));
    }

    @Test
    void resolvesBySuffixCaseInsensitive() throws Exception {
        BackupFixture fixture = BackupFixture.create(root);
        Path blob = fixture.register("HomeDomain", BackupFixture.SMS_PATH);
        Files.writeString(blob, "x");

        try (BackupContainer container = reader.open(root)) {
            assertEquals(Optional.of(blob), container.resolve("sms.db"));
            assertEquals(Optional.of(blob), container.resolve("SMS/SMS.DB"));
            assertEquals(1, container.entryCount());
        }
    }

    @Test
    void indexEntryWithoutBlobIsNotFound() {
        BackupFixture fixture = BackupFixture.create(root);
        fixture.register("HomeDomain", BackupFixture.SMS_PATH);

        try (BackupContainer container = reader.open(root)) {
            assertTrue(container.resolve("sms.db").isEmpty());
            assertTrue(container.resolve("AddressBook.sqlitedb").isEmpty());
        }
    }

    @Test
    void shortestExistingPathWins() throws Exception {
        BackupFixture fixture = BackupFixture.create(root);
        Path deep = fixture.register("AppDomain-x", "Documents/backup/Library/SMS/sms.db");
        Path main = fixture.register("HomeDomain", BackupFixture.SMS_PATH);
        Files.writeString(deep, "x");
        Files.writeString(main, "y");

        try (BackupContainer container = reader.open(root)) {
            assertEquals(Optional.of(main), container.resolve("sms.db"));
        }
    }

    @Test
    void resolveAfterCloseFails() {
        BackupFixture.create(root);
        BackupContainer container = reader.open(root);
        container.close();

        assertTrue(container.isClosed());
        assertThrows(IllegalStateException.class, () -> container.resolve("sms.db"));
    }
}
