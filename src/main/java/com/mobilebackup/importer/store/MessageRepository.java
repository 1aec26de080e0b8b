package com.mobilebackup.importer.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobilebackup.importer.model.ChannelKind;
import com.mobilebackup.importer.model.ConversationThread;
import com.mobilebackup.importer.model.MessageDirection;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.model.MessageStats;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 消息、会话、附件三张表的读写。
 * 会话聚合字段（last_* / unread_count / message_count）只通过这里的方法维护。
 */
@Repository
public class MessageRepository {

    /** 预览截断长度 */
    private static final int PREVIEW_LENGTH = 120;

    private static final String THREAD_SELECT = """
            SELECT t.*, c.display_name AS contact_name
            FROM message_threads t
            LEFT JOIN contacts c ON c.id = t.contact_id
            """;

    private final JdbcTemplate jdbc;
    private final JsonColumns json;

    private final RowMapper<ConversationThread> threadMapper = this::mapThread;
    private final RowMapper<MessageRecord> messageMapper = this::mapMessage;

    public MessageRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumns(objectMapper);
    }

    // ===== messages =====

    public boolean exists(String messageId) {
        Integer n = jdbc.queryForObject("SELECT count(*) FROM messages WHERE id = ?", Integer.class, messageId);
        return n != null && n > 0;
    }

    /**
     * 同会话内是否已有同签名、时间差在窗口内的消息。
     */
    public boolean hasSignatureWithin(String threadId, String signature, Instant timestamp, long windowMs) {
        long ts = timestamp.toEpochMilli();
        Integer n = jdbc.queryForObject("""
                        SELECT count(*) FROM messages
                        WHERE thread_id = ? AND signature = ? AND timestamp BETWEEN ? AND ?
                        """,
                Integer.class, threadId, signature, ts - windowMs, ts + windowMs);
        return n != null && n > 0;
    }

    /** id 冲突时返回 false，不覆盖已有数据 */
    public boolean insertMessage(MessageRecord m, String signature, long nowMs) {
        int n = jdbc.update("""
                        INSERT INTO messages (id, thread_id, phone, identity_key, content, signature, channel,
                                              direction, timestamp, read_status, delivered_status, failed_status,
                                              created_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        ON CONFLICT(id) DO NOTHING
                        """,
                m.getId(), m.getThreadId(), m.getPhone(), m.getIdentityKey(),
                m.getText() == null ? "" : m.getText(), signature, m.getChannel().storeValue(),
                m.getDirection().name(), m.getTimestamp().toEpochMilli(),
                m.isRead() ? 1 : 0, m.isDelivered() ? 1 : 0, m.isFailed() ? 1 : 0, nowMs);
        if (n == 0) {
            return false;
        }
        for (String file : m.getAttachments()) {
            jdbc.update("INSERT INTO message_attachments (message_id, file_path) VALUES (?, ?)", m.getId(), file);
        }
        return true;
    }

    public List<MessageRecord> listMessages(String threadId, int offset, int limit) {
        List<MessageRecord> list = jdbc.query("""
                        SELECT * FROM messages WHERE thread_id = ?
                        ORDER BY timestamp ASC, id ASC LIMIT ? OFFSET ?
                        """,
                messageMapper, threadId, limit, offset);
        attachAttachments(list);
        return list;
    }

    public long countMessages(String threadId) {
        Long n = jdbc.queryForObject("SELECT count(*) FROM messages WHERE thread_id = ?", Long.class, threadId);
        return n == null ? 0 : n;
    }

    public List<MessageRecord> search(String query, int limit) {
        String like = "%" + query.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
        List<MessageRecord> list = jdbc.query("""
                        SELECT * FROM messages WHERE content LIKE ? ESCAPE '\\'
                        ORDER BY timestamp DESC LIMIT ?
                        """,
                messageMapper, like, limit);
        attachAttachments(list);
        return list;
    }

    public MessageStats stats() {
        return jdbc.queryForObject("""
                SELECT count(*) AS total,
                       coalesce(sum(CASE WHEN direction = 'INBOUND' THEN 1 ELSE 0 END), 0) AS inbound,
                       coalesce(sum(CASE WHEN direction = 'OUTBOUND' THEN 1 ELSE 0 END), 0) AS outbound,
                       coalesce(sum(CASE WHEN channel = 'imessage' THEN 1 ELSE 0 END), 0) AS ip,
                       coalesce(sum(CASE WHEN channel = 'sms' THEN 1 ELSE 0 END), 0) AS sms,
                       coalesce(sum(CASE WHEN read_status = 0 THEN 1 ELSE 0 END), 0) AS unread,
                       (SELECT count(*) FROM message_threads) AS threads
                FROM messages
                """, (rs, i) -> {
            MessageStats s = new MessageStats();
            s.setTotalMessages(rs.getLong("total"));
            s.setInboundMessages(rs.getLong("inbound"));
            s.setOutboundMessages(rs.getLong("outbound"));
            s.setIpMessages(rs.getLong("ip"));
            s.setSmsMessages(rs.getLong("sms"));
            s.setUnreadMessages(rs.getLong("unread"));
            s.setTotalThreads(rs.getLong("threads"));
            return s;
        });
    }

    public long countAllMessages() {
        Long n = jdbc.queryForObject("SELECT count(*) FROM messages", Long.class);
        return n == null ? 0 : n;
    }

    /** 清理用：全部消息的最小投影，按时间升序 */
    public List<MessageRecord> listAllForDedup() {
        return jdbc.query("""
                SELECT id, thread_id, identity_key, content, timestamp FROM messages
                ORDER BY timestamp ASC, created_at ASC, id ASC
                """, (rs, i) -> {
            MessageRecord m = new MessageRecord();
            m.setId(rs.getString("id"));
            m.setThreadId(rs.getString("thread_id"));
            m.setIdentityKey(rs.getString("identity_key"));
            m.setText(rs.getString("content"));
            m.setTimestamp(Instant.ofEpochMilli(rs.getLong("timestamp")));
            return m;
        });
    }

    public int deleteMessages(Collection<String> messageIds) {
        int removed = 0;
        for (String id : messageIds) {
            jdbc.update("DELETE FROM message_attachments WHERE message_id = ?", id);
            removed += jdbc.update("DELETE FROM messages WHERE id = ?", id);
        }
        return removed;
    }

    /** 没有所属会话的消息 */
    public int deleteOrphanedMessages() {
        jdbc.update("""
                DELETE FROM message_attachments WHERE message_id IN (
                  SELECT m.id FROM messages m LEFT JOIN message_threads t ON m.thread_id = t.id WHERE t.id IS NULL)
                """);
        return jdbc.update("""
                DELETE FROM messages WHERE id IN (
                  SELECT m.id FROM messages m LEFT JOIN message_threads t ON m.thread_id = t.id WHERE t.id IS NULL)
                """);
    }

    // ===== threads =====

    public Optional<ConversationThread> findThread(String threadId) {
        return jdbc.query(THREAD_SELECT + " WHERE t.id = ?", threadMapper, threadId).stream().findFirst();
    }

    /** 返回实际变化的行数，状态相同时为 0 */
    public int updateDeliveryStatus(String messageId, boolean delivered, boolean failed) {
        int d = delivered ? 1 : 0;
        int f = failed ? 1 : 0;
        return jdbc.update("""
                        UPDATE messages SET delivered_status = ?, failed_status = ?
                        WHERE id = ? AND (delivered_status <> ? OR failed_status <> ?)
                        """,
                d, f, messageId, d, f);
    }

    public Optional<String> findThreadIdByKey(String conversationKey) {
        return jdbc.queryForList("SELECT id FROM message_threads WHERE conversation_key = ?", String.class,
                conversationKey).stream().findFirst();
    }

    public boolean threadIdExists(String threadId) {
        Integer n = jdbc.queryForObject("SELECT count(*) FROM message_threads WHERE id = ?", Integer.class, threadId);
        return n != null && n > 0;
    }

    /**
     * 会话不存在时创建（空聚合）。并发下以 conversation_key 唯一约束兜底。
     */
    public void createThreadIfAbsent(MessageRecord first, String contactId, long nowMs) {
        jdbc.update("""
                        INSERT INTO message_threads (id, conversation_key, phone, contact_id, is_group, group_name,
                                                     participants_json, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                        ON CONFLICT DO NOTHING
                        """,
                first.getThreadId(), first.getConversationKey(), first.getPhone(), contactId,
                first.isGroup() ? 1 : 0, first.getGroupName(), json.write(first.getParticipants()), nowMs, nowMs);
    }

    /**
     * 新消息入库后增量更新会话聚合；只有时间不早于当前 last_activity 时才替换最后一条。
     */
    public void applyMessageToThread(MessageRecord m, long nowMs) {
        long ts = m.getTimestamp().toEpochMilli();
        jdbc.update("""
                        UPDATE message_threads SET
                          message_count = message_count + 1,
                          unread_count = unread_count + ?,
                          last_message_id = CASE WHEN last_activity IS NULL OR ? >= last_activity
                                                 THEN ? ELSE last_message_id END,
                          last_message_preview = CASE WHEN last_activity IS NULL OR ? >= last_activity
                                                      THEN ? ELSE last_message_preview END,
                          last_activity = CASE WHEN last_activity IS NULL OR ? >= last_activity
                                               THEN ? ELSE last_activity END,
                          updated_at = ?
                        WHERE id = ?
                        """,
                m.isRead() ? 0 : 1,
                ts, m.getId(),
                ts, preview(m.getText()),
                ts, ts,
                nowMs, m.getThreadId());
    }

    /**
     * 按消息表重新计算会话聚合，用于批量导入后的自愈和清理之后。
     * 同一时间戳的多条消息取 id 最大者，和增量更新“后到者胜出”保持一致。
     */
    public int recomputeThreads(Collection<String> threadIds, long nowMs) {
        int updated = 0;
        for (String threadId : threadIds) {
            List<Map<String, Object>> last = jdbc.queryForList("""
                    SELECT id, content, timestamp FROM messages WHERE thread_id = ?
                    ORDER BY timestamp DESC, created_at DESC, id DESC LIMIT 1
                    """, threadId);
            Long count = jdbc.queryForObject(
                    "SELECT count(*) FROM messages WHERE thread_id = ?", Long.class, threadId);
            Long unread = jdbc.queryForObject(
                    "SELECT count(*) FROM messages WHERE thread_id = ? AND read_status = 0", Long.class, threadId);

            if (last.isEmpty()) {
                updated += jdbc.update("""
                        UPDATE message_threads SET last_message_id = NULL, last_message_preview = NULL,
                               last_activity = NULL, unread_count = 0, message_count = 0, updated_at = ?
                        WHERE id = ?
                        """, nowMs, threadId);
                continue;
            }
            Map<String, Object> row = last.get(0);
            updated += jdbc.update("""
                            UPDATE message_threads SET last_message_id = ?, last_message_preview = ?,
                                   last_activity = ?, unread_count = ?, message_count = ?, updated_at = ?
                            WHERE id = ?
                            """,
                    row.get("id"), preview((String) row.get("content")), ((Number) row.get("timestamp")).longValue(),
                    unread == null ? 0 : unread, count == null ? 0 : count, nowMs, threadId);
        }
        return updated;
    }

    public List<ConversationThread> listThreads(int offset, int limit, boolean includeArchived) {
        return jdbc.query(THREAD_SELECT
                        + (includeArchived ? "" : " WHERE t.archived = 0")
                        + " ORDER BY t.last_activity DESC, t.id ASC LIMIT ? OFFSET ?",
                threadMapper, limit, offset);
    }

    public long countThreads(boolean includeArchived) {
        Long n = jdbc.queryForObject("SELECT count(*) FROM message_threads"
                + (includeArchived ? "" : " WHERE archived = 0"), Long.class);
        return n == null ? 0 : n;
    }

    public List<String> allThreadIds() {
        return jdbc.queryForList("SELECT id FROM message_threads", String.class);
    }

    /** 已读标记：消息和会话未读数一起清零 */
    public int markThreadRead(String threadId, long nowMs) {
        int n = jdbc.update("UPDATE messages SET read_status = 1 WHERE thread_id = ? AND read_status = 0", threadId);
        jdbc.update("UPDATE message_threads SET unread_count = 0, updated_at = ? WHERE id = ?", nowMs, threadId);
        return n;
    }

    public void setArchived(String threadId, boolean archived, long nowMs) {
        jdbc.update("UPDATE message_threads SET archived = ?, updated_at = ? WHERE id = ?",
                archived ? 1 : 0, nowMs, threadId);
    }

    public int deleteEmptyThreads() {
        return jdbc.update("""
                DELETE FROM message_threads
                WHERE NOT EXISTS (SELECT 1 FROM messages m WHERE m.thread_id = message_threads.id)
                """);
    }

    /** 联系人导入后，把还没关联联系人的会话补上 */
    public int linkThreadsToContact(String contactId, Collection<String> identityKeys, long nowMs) {
        int n = 0;
        for (String key : identityKeys) {
            n += jdbc.update("""
                    UPDATE message_threads SET contact_id = ?, updated_at = ?
                    WHERE contact_id IS NULL AND is_group = 0 AND conversation_key = ?
                    """, contactId, nowMs, key);
        }
        return n;
    }

    // ===== mapping =====

    private ConversationThread mapThread(ResultSet rs, int rowNum) throws SQLException {
        ConversationThread t = new ConversationThread();
        t.setId(rs.getString("id"));
        t.setConversationKey(rs.getString("conversation_key"));
        t.setPhone(rs.getString("phone"));
        t.setContactId(rs.getString("contact_id"));
        t.setContactName(rs.getString("contact_name"));
        t.setLastMessageId(rs.getString("last_message_id"));
        t.setLastMessagePreview(rs.getString("last_message_preview"));
        long last = rs.getLong("last_activity");
        t.setLastActivity(rs.wasNull() ? null : Instant.ofEpochMilli(last));
        t.setUnreadCount(rs.getInt("unread_count"));
        t.setMessageCount(rs.getInt("message_count"));
        t.setGroup(rs.getInt("is_group") == 1);
        t.setGroupName(rs.getString("group_name"));
        t.setParticipants(json.readStrings(rs.getString("participants_json")));
        t.setArchived(rs.getInt("archived") == 1);
        return t;
    }

    private MessageRecord mapMessage(ResultSet rs, int rowNum) throws SQLException {
        MessageRecord m = new MessageRecord();
        m.setId(rs.getString("id"));
        m.setThreadId(rs.getString("thread_id"));
        m.setPhone(rs.getString("phone"));
        m.setIdentityKey(rs.getString("identity_key"));
        m.setText(rs.getString("content"));
        m.setChannel(ChannelKind.fromStoreValue(rs.getString("channel")));
        m.setDirection(MessageDirection.valueOf(rs.getString("direction")));
        m.setTimestamp(Instant.ofEpochMilli(rs.getLong("timestamp")));
        m.setRead(rs.getInt("read_status") == 1);
        m.setDelivered(rs.getInt("delivered_status") == 1);
        m.setFailed(rs.getInt("failed_status") == 1);
        return m;
    }

    private void attachAttachments(List<MessageRecord> messages) {
        if (messages.isEmpty()) {
            return;
        }
        Map<String, MessageRecord> byId = new HashMap<>();
        messages.forEach(m -> byId.put(m.getId(), m));
        String placeholders = String.join(",", java.util.Collections.nCopies(byId.size(), "?"));
        jdbc.query("SELECT message_id, file_path FROM message_attachments WHERE message_id IN (" + placeholders
                        + ") ORDER BY id",
                rs -> {
                    MessageRecord m = byId.get(rs.getString("message_id"));
                    if (m != null) {
                        m.getAttachments().add(rs.getString("file_path"));
                    }
                },
                new ArrayList<>(byId.keySet()).toArray());
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH);
    }
}
