package com.mobilebackup.importer.store;

import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.model.SyncHistoryEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * 同步历史：每次运行开始插一行 RUNNING，结束时回填状态和计数。
 */
@Repository
@RequiredArgsConstructor
public class SyncHistoryRepository {

    private static final RowMapper<SyncHistoryEntry> HISTORY_MAPPER = (rs, i) -> {
        SyncHistoryEntry e = new SyncHistoryEntry();
        e.setId(rs.getLong("id"));
        e.setCategory(RecordCategory.fromKey(rs.getString("category")));
        e.setBackupPath(rs.getString("backup_path"));
        e.setStatus(rs.getString("status"));
        e.setStartedAt(Instant.ofEpochMilli(rs.getLong("started_at")));
        long finished = rs.getLong("finished_at");
        e.setFinishedAt(rs.wasNull() ? null : Instant.ofEpochMilli(finished));
        e.setImported(rs.getInt("imported"));
        e.setSkipped(rs.getInt("skipped"));
        e.setErrors(rs.getInt("errors"));
        e.setErrorMessage(rs.getString("error_message"));
        return e;
    };

    private final JdbcTemplate jdbc;

    /** 返回新行 id（INSERT ... RETURNING，需要 SQLite 3.35+） */
    public long start(RecordCategory category, String backupPath, Instant startedAt) {
        Long id = jdbc.queryForObject("""
                        INSERT INTO sync_history (category, backup_path, status, started_at)
                        VALUES (?, ?, 'RUNNING', ?)
                        RETURNING id
                        """,
                Long.class, category.key(), backupPath, startedAt.toEpochMilli());
        return id == null ? -1 : id;
    }

    public void finish(long id, String status, Instant finishedAt, int imported, int skipped, int errors,
                       String errorMessage) {
        jdbc.update("""
                        UPDATE sync_history SET status = ?, finished_at = ?, imported = ?, skipped = ?, errors = ?,
                                                error_message = ?
                        WHERE id = ?
                        """,
                status, finishedAt.toEpochMilli(), imported, skipped, errors, errorMessage, id);
    }

    /** category 为 null 时返回全部类别 */
    public List<SyncHistoryEntry> recent(RecordCategory category, int limit) {
        if (category == null) {
            return jdbc.query("SELECT * FROM sync_history ORDER BY started_at DESC, id DESC LIMIT ?",
                    HISTORY_MAPPER, limit);
        }
        return jdbc.query("SELECT * FROM sync_history WHERE category = ? ORDER BY started_at DESC, id DESC LIMIT ?",
                HISTORY_MAPPER, category.key(), limit);
    }
}
