package com.mobilebackup.importer.store;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 本地库表结构。启动时建表，全部 IF NOT EXISTS，可重复执行。
 * 时间统一存 epoch 毫秒。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreSchema {

    private static final String CREATE_CONTACTS_SQL = """
            CREATE TABLE IF NOT EXISTS contacts (
              id TEXT PRIMARY KEY,
              given_name TEXT,
              family_name TEXT,
              display_name TEXT NOT NULL,
              organization TEXT,
              notes TEXT,
              phones_json TEXT NOT NULL DEFAULT '[]',
              emails_json TEXT NOT NULL DEFAULT '[]',
              created_at INTEGER NOT NULL,
              updated_at INTEGER NOT NULL
            )
            """;

    private static final String CREATE_CONTACT_IDENTITIES_SQL = """
            CREATE TABLE IF NOT EXISTS contact_identities (
              contact_id TEXT NOT NULL,
              identity_key TEXT NOT NULL,
              PRIMARY KEY (contact_id, identity_key)
            )
            """;

    private static final String CREATE_THREADS_SQL = """
            CREATE TABLE IF NOT EXISTS message_threads (
              id TEXT PRIMARY KEY,
              conversation_key TEXT NOT NULL UNIQUE,
              phone TEXT,
              contact_id TEXT,
              last_message_id TEXT,
              last_message_preview TEXT,
              last_activity INTEGER,
              unread_count INTEGER NOT NULL DEFAULT 0,
              message_count INTEGER NOT NULL DEFAULT 0,
              is_group INTEGER NOT NULL DEFAULT 0,
              group_name TEXT,
              participants_json TEXT NOT NULL DEFAULT '[]',
              archived INTEGER NOT NULL DEFAULT 0,
              created_at INTEGER NOT NULL,
              updated_at INTEGER NOT NULL
            )
            """;

    private static final String CREATE_MESSAGES_SQL = """
            CREATE TABLE IF NOT EXISTS messages (
              id TEXT PRIMARY KEY,
              thread_id TEXT NOT NULL,
              phone TEXT,
              identity_key TEXT NOT NULL,
              content TEXT NOT NULL,
              signature TEXT NOT NULL,
              channel TEXT NOT NULL,
              direction TEXT NOT NULL,
              timestamp INTEGER NOT NULL,
              read_status INTEGER NOT NULL DEFAULT 0,
              delivered_status INTEGER NOT NULL DEFAULT 0,
              failed_status INTEGER NOT NULL DEFAULT 0,
              created_at INTEGER NOT NULL
            )
            """;

    private static final String CREATE_ATTACHMENTS_SQL = """
            CREATE TABLE IF NOT EXISTS message_attachments (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              message_id TEXT NOT NULL,
              file_path TEXT NOT NULL
            )
            """;

    private static final String CREATE_CALL_LOGS_SQL = """
            CREATE TABLE IF NOT EXISTS call_logs (
              id TEXT PRIMARY KEY,
              phone TEXT NOT NULL,
              identity_key TEXT NOT NULL,
              contact_id TEXT,
              direction TEXT NOT NULL,
              call_kind TEXT NOT NULL DEFAULT 'VOICE',
              duration INTEGER NOT NULL DEFAULT 0,
              start_time INTEGER NOT NULL,
              created_at INTEGER NOT NULL
            )
            """;

    private static final String CREATE_SYNC_HISTORY_SQL = """
            CREATE TABLE IF NOT EXISTS sync_history (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              category TEXT NOT NULL,
              backup_path TEXT,
              status TEXT NOT NULL,
              started_at INTEGER NOT NULL,
              finished_at INTEGER,
              imported INTEGER NOT NULL DEFAULT 0,
              skipped INTEGER NOT NULL DEFAULT 0,
              errors INTEGER NOT NULL DEFAULT 0,
              error_message TEXT
            )
            """;

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS idx_contact_identities_key ON contact_identities(identity_key)",
            "CREATE INDEX IF NOT EXISTS idx_messages_thread_signature ON messages(thread_id, signature)",
            "CREATE INDEX IF NOT EXISTS idx_messages_thread_timestamp ON messages(thread_id, timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_messages_identity ON messages(identity_key)",
            "CREATE INDEX IF NOT EXISTS idx_message_attachments_message ON message_attachments(message_id)",
            "CREATE INDEX IF NOT EXISTS idx_threads_last_activity ON message_threads(last_activity DESC)",
            "CREATE INDEX IF NOT EXISTS idx_call_logs_start_time ON call_logs(start_time DESC)",
            "CREATE INDEX IF NOT EXISTS idx_call_logs_identity ON call_logs(identity_key)",
            "CREATE INDEX IF NOT EXISTS idx_sync_history_category ON sync_history(category, started_at DESC)"
    );

    private final JdbcTemplate jdbc;

    @PostConstruct
    public void initialize() {
        for (String ddl : List.of(CREATE_CONTACTS_SQL, CREATE_CONTACT_IDENTITIES_SQL, CREATE_THREADS_SQL,
                CREATE_MESSAGES_SQL, CREATE_ATTACHMENTS_SQL, CREATE_CALL_LOGS_SQL, CREATE_SYNC_HISTORY_SQL)) {
            jdbc.execute(ddl);
        }
        INDEXES.forEach(jdbc::execute);
        log.info("本地库表结构已就绪");
    }
}
