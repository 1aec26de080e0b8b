package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.sync.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * 三个提取器共用的骨架：解析路径 → 只读打开 → 交给子类开游标。
 * 源库缺失或损坏只影响本类别，返回空结果加警告。
 */
@Slf4j
public abstract class AbstractSqliteExtractor<T> implements RecordExtractor<T> {

    @Override
    public Extraction<T> extract(BackupContainer container, CancellationToken token) {
        Optional<Path> db = container.resolve(sourceFileName());
        if (db.isEmpty()) {
            log.warn("备份中没有 {} 数据库 ({})，跳过该类别", category().key(), sourceFileName());
            return Extraction.notPresent(category(), sourceFileName());
        }
        return extractFromDatabase(db.get(), token);
    }

    /**
     * 直接从一个内嵌库文件提取，不经过容器索引。
     */
    public Extraction<T> extractFromDatabase(Path databaseFile, CancellationToken token) {
        Connection conn;
        try {
            conn = EmbeddedDatabase.openReadOnly(databaseFile);
        } catch (SQLException e) {
            log.warn("{} 数据库无法打开: {} ({})", category().key(), databaseFile, e.getMessage());
            return Extraction.unreadable(category(), sourceFileName(), e.getMessage());
        }

        try {
            Extraction<T> extraction = openRows(conn, token);
            log.info("{} 数据库已打开: {}", category().key(), databaseFile);
            return extraction;
        } catch (SQLException | RuntimeException e) {
            log.warn("{} 数据库查询失败: {} ({})", category().key(), databaseFile, e.getMessage());
            try {
                conn.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            return Extraction.unreadable(category(), sourceFileName(), e.getMessage());
        }
    }

    /**
     * 子类校验 schema 并开游标。抛出的 SQLException 视为该库不可读。
     */
    protected abstract Extraction<T> openRows(Connection conn, CancellationToken token) throws SQLException;

    protected static String str(Object v) {
        if (v == null) {
            return null;
        }
        if (v instanceof byte[] bytes) {
            return new String(bytes, java.nio.charset.StandardCharsets.UTF_8);
        }
        return v.toString();
    }
}
