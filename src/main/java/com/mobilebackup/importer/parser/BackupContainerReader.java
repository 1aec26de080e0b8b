package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.codec.VendorTimeCodec;
import com.mobilebackup.importer.config.ImporterProperties;
import com.mobilebackup.importer.exception.BackupEncryptedException;
import com.mobilebackup.importer.exception.ManifestUnavailableException;
import com.mobilebackup.importer.model.BackupManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 打开备份根目录下的 Manifest 索引，解析 Preferences 得到 BackupManifest，
 * 返回持有只读索引连接的 BackupContainer。
 *
 * 致命错误：
 * - 索引文件不存在 / 不是库 / 缺表 → ManifestUnavailableException
 * - IsEncrypted 为真 → BackupEncryptedException（不尝试解密）
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackupContainerReader {

    private final ImporterProperties properties;

    /** Preferences.Date 可能是 ISO 文本，也可能是厂商纪元秒数，按顺序尝试 */
    private static final List<DateTimeFormatter> DATE_FORMATTERS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
    );

    public BackupContainer open(Path backupRoot) {
        Path manifestPath = backupRoot.resolve(properties.getManifestFileName());
        if (!Files.isRegularFile(manifestPath)) {
            log.error("备份索引不存在: {}", manifestPath);
            throw new ManifestUnavailableException(manifestPath, "file not found");
        }

        Connection conn;
        try {
            conn = EmbeddedDatabase.openReadOnly(manifestPath);
        } catch (SQLException e) {
            log.error("备份索引无法打开: {}", manifestPath, e);
            throw new ManifestUnavailableException(manifestPath, e);
        }

        try {
            if (!EmbeddedDatabase.hasTable(conn, "Preferences") || !EmbeddedDatabase.hasTable(conn, "Files")) {
                throw new ManifestUnavailableException(manifestPath, "missing Preferences or Files table");
            }
            BackupManifest manifest = readManifest(conn);
            if (manifest.isEncrypted()) {
                log.error("备份已加密，拒绝导入: device={}", manifest.getDeviceName());
                throw new BackupEncryptedException(manifest.getDeviceName());
            }
            log.info("备份容器已打开: root={}, device={}, os={}, version={}",
                    backupRoot, manifest.getDeviceName(), manifest.getOsVersion(), manifest.getVersion());
            return new BackupContainer(backupRoot, manifest, conn);
        } catch (SQLException e) {
            closeAfterFailure(conn);
            throw new ManifestUnavailableException(manifestPath, e);
        } catch (RuntimeException e) {
            closeAfterFailure(conn);
            throw e;
        }
    }

    private BackupManifest readManifest(Connection conn) throws SQLException {
        Map<String, Object> prefs = new HashMap<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT key, value FROM Preferences")) {
            while (rs.next()) {
                prefs.put(rs.getString("key"), rs.getObject("value"));
            }
        }

        BackupManifest m = new BackupManifest();
        m.setVersion(text(prefs.get("Version"), "0.0"));
        m.setCreatedAt(parseDate(prefs.get("Date")));
        m.setDeviceName(text(prefs.get("Device Name"), "Unknown iPhone"));
        m.setDeviceId(text(prefs.get("Unique Identifier"), ""));
        m.setOsVersion(text(prefs.get("Product Version"), "Unknown"));
        m.setEncrypted(truthy(prefs.get("IsEncrypted")));
        return m;
    }

    private static String text(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? fallback : s;
    }

    private static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        return s.equals("1") || s.equals("true") || s.equals("yes");
    }

    /** 数字按厂商纪元秒处理，文本按多种格式尝试，都不行就返回 null */
    private Instant parseDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return VendorTimeCodec.toInstant(n);
        }
        String s = value.toString().trim();
        for (DateTimeFormatter f : DATE_FORMATTERS) {
            try {
                if (f == DateTimeFormatter.ISO_OFFSET_DATE_TIME) {
                    return OffsetDateTime.parse(s, f).toInstant();
                }
                return LocalDateTime.parse(s, f).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                // 尝试下一种格式
            }
        }
        log.debug("无法解析备份时间: {}", s);
        return null;
    }

    private static void closeAfterFailure(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("关闭 Manifest 连接失败: {}", e.getMessage());
        }
    }
}
