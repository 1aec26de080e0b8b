package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.model.BackupManifest;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 已打开的备份容器：持有 manifest 以及 Manifest.db 的只读连接。
 * 一次导入开一次，提取结束（无论成败）后 close 释放连接。
 */
@Slf4j
public class BackupContainer implements AutoCloseable {

    private static final String RESOLVE_SQL =
            "SELECT fileID, domain, relativePath FROM Files WHERE relativePath LIKE ? ESCAPE '\\'";

    private final Path root;
    private final BackupManifest manifest;
    private final Connection index;
    private volatile boolean closed;

    BackupContainer(Path root, BackupManifest manifest, Connection index) {
        this.root = root;
        this.manifest = manifest;
        this.index = index;
    }

    public Path getRoot() {
        return root;
    }

    public BackupManifest getManifest() {
        return manifest;
    }

    /**
     * 按路径后缀查找 blob，大小写不敏感（SQLite LIKE 对 ASCII 不区分大小写）。
     * 调用方一般只知道文件名（AddressBook.sqlitedb），不知道随系统版本变化的完整路径。
     * 多条命中时取 blob 实际存在、路径最短的那条。
     */
    public Optional<Path> resolve(String relativePathSuffix) {
        ensureOpen();
        if (relativePathSuffix == null || relativePathSuffix.isBlank()) {
            return Optional.empty();
        }

        List<ContainerIndexEntry> hits = new ArrayList<>();
        try (PreparedStatement ps = index.prepareStatement(RESOLVE_SQL)) {
            ps.setString(1, "%" + escapeLike(relativePathSuffix));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ContainerIndexEntry e = new ContainerIndexEntry();
                    e.setFileId(rs.getString("fileID"));
                    e.setDomain(rs.getString("domain"));
                    e.setRelativePath(rs.getString("relativePath"));
                    if (e.getFileId() != null && !e.getFileId().isBlank()) {
                        hits.add(e);
                    }
                }
            }
        } catch (SQLException e) {
            log.warn("查询索引失败: suffix={}, err={}", relativePathSuffix, e.getMessage());
            return Optional.empty();
        }

        hits.sort(Comparator.comparingInt(e -> e.getRelativePath().length()));
        for (ContainerIndexEntry hit : hits) {
            Path blob = blobPath(hit.getFileId());
            if (Files.isRegularFile(blob)) {
                log.debug("索引命中: {} -> {}", hit.logicalPath(), blob);
                return Optional.of(blob);
            }
            log.debug("索引命中但 blob 不存在: {} -> {}", hit.logicalPath(), blob);
        }
        return Optional.empty();
    }

    /** blob 存放在 <root>/<fileID 前两位>/<fileID> */
    public Path blobPath(String fileId) {
        String id = fileId.trim().toLowerCase(Locale.ROOT);
        return root.resolve(id.substring(0, Math.min(2, id.length()))).resolve(id);
    }

    /** Files 表总行数 */
    public int entryCount() {
        ensureOpen();
        try (Statement st = index.createStatement();
             ResultSet rs = st.executeQuery("SELECT count(*) FROM Files")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            log.warn("统计索引条目失败: {}", e.getMessage());
            return 0;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Backup container already closed: " + root);
        }
    }

    private static String escapeLike(String v) {
        return v.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            index.close();
            log.info("备份容器已关闭: {}", root);
        } catch (SQLException e) {
            log.warn("关闭 Manifest 连接失败: {}", e.getMessage());
        }
    }
}
