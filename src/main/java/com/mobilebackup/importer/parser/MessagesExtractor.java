package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.codec.PhoneNumberCodec;
import com.mobilebackup.importer.codec.VendorTimeCodec;
import com.mobilebackup.importer.model.ChannelKind;
import com.mobilebackup.importer.model.MessageDirection;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.sync.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * sms.db → MessageRecord。
 *
 * message 关联 handle 得到对端身份；有 chat 表时再经 chat_message_join 关联会话，
 * 用来识别群聊（参与方 > 1）。附件走 message_attachment_join，丢弃 filename 为空的行。
 * conversationKey 留给 ConversationKeyStrategy 决定。
 */
@Component
@Slf4j
public class MessagesExtractor extends AbstractSqliteExtractor<MessageRecord> {

    public static final String SOURCE_FILE = "sms.db";

    private static final String ATTACHMENT_SQL = """
            SELECT a.filename
            FROM message_attachment_join j
            JOIN attachment a ON j.attachment_id = a.ROWID
            WHERE j.message_id = ?
            ORDER BY a.ROWID
            """;

    private static final String PARTICIPANT_SQL = """
            SELECT h.id
            FROM chat_handle_join chj
            JOIN handle h ON chj.handle_id = h.ROWID
            WHERE chj.chat_id = ?
            ORDER BY h.ROWID
            """;

    @Override
    public RecordCategory category() {
        return RecordCategory.MESSAGES;
    }

    @Override
    public String sourceFileName() {
        return SOURCE_FILE;
    }

    @Override
    protected Extraction<MessageRecord> openRows(Connection conn, CancellationToken token) throws SQLException {
        if (!EmbeddedDatabase.hasTable(conn, "message")) {
            throw new SQLException("message table missing");
        }
        Set<String> messageColumns = EmbeddedDatabase.columns(conn, "message");
        boolean hasHandles = EmbeddedDatabase.hasTable(conn, "handle");
        boolean hasChats = EmbeddedDatabase.hasTable(conn, "chat")
                && EmbeddedDatabase.hasTable(conn, "chat_message_join");
        boolean hasParticipants = hasChats && hasHandles && EmbeddedDatabase.hasTable(conn, "chat_handle_join");
        boolean hasAttachments = EmbeddedDatabase.hasTable(conn, "message_attachment_join")
                && EmbeddedDatabase.hasTable(conn, "attachment");
        boolean hasIsRead = messageColumns.contains("is_read");

        String sql = buildQuery(hasHandles, hasChats, hasIsRead);
        log.debug("sms.db schema: handles={}, chats={}, attachments={}, is_read={}",
                hasHandles, hasChats, hasAttachments, hasIsRead);

        // 同一个 chat 的参与方只查一次
        Map<Long, List<String>> participantCache = new HashMap<>();

        return SqliteRowStream.open(category(), conn, sql, rs -> {
            MessageRecord m = decode(rs, hasChats, hasIsRead);
            if (hasAttachments) {
                m.setAttachments(attachments(conn, rs.getLong("rowid")));
            }
            if (hasChats) {
                long chatRowId = rs.getLong("chat_rowid");
                if (!rs.wasNull() && hasParticipants) {
                    List<String> participants = participantCache.get(chatRowId);
                    if (participants == null) {
                        participants = participants(conn, chatRowId);
                        participantCache.put(chatRowId, participants);
                    }
                    m.setParticipants(new ArrayList<>(participants));
                    m.setGroup(participants.size() > 1);
                }
            }
            return m;
        }, token);
    }

    private static String buildQuery(boolean hasHandles, boolean hasChats, boolean hasIsRead) {
        StringBuilder sql = new StringBuilder()
                .append("SELECT m.ROWID AS rowid, m.guid, m.text, m.service, m.is_from_me, m.date")
                .append(hasIsRead ? ", m.is_read" : "")
                .append(hasHandles ? ", h.id AS handle_id" : ", NULL AS handle_id")
                .append(hasChats ? ", c.ROWID AS chat_rowid, c.chat_identifier, c.display_name" : "")
                .append(" FROM message m");
        if (hasHandles) {
            sql.append(" LEFT JOIN handle h ON m.handle_id = h.ROWID");
        }
        if (hasChats) {
            sql.append(" LEFT JOIN chat_message_join cmj ON cmj.message_id = m.ROWID")
                    .append(" LEFT JOIN chat c ON c.ROWID = cmj.chat_id");
        }
        sql.append(" WHERE m.text IS NOT NULL ORDER BY m.date ASC, m.ROWID ASC");
        return sql.toString();
    }

    private MessageRecord decode(ResultSet rs, boolean hasChats, boolean hasIsRead) throws SQLException {
        long rowId = rs.getLong("rowid");
        double date = rs.getDouble("date");
        if (rs.wasNull()) {
            throw new SQLException("message.date is null");
        }

        boolean fromMe = rs.getInt("is_from_me") == 1;
        String guid = str(rs.getObject("guid"));

        MessageRecord m = new MessageRecord();
        m.setId(guid == null || guid.isBlank() ? "rowid:" + rowId : guid);
        m.setText(str(rs.getObject("text")));
        m.setChannel(ChannelKind.fromService(str(rs.getObject("service"))));
        m.setDirection(MessageDirection.fromMe(fromMe));
        m.setTimestamp(VendorTimeCodec.toInstant(date));

        // 本机发出的消息 handle 经常是 0，退回到 chat_identifier
        String handle = str(rs.getObject("handle_id"));
        String chatIdentifier = hasChats ? str(rs.getObject("chat_identifier")) : null;
        String identity = handle != null && !handle.isBlank() ? handle : chatIdentifier;
        m.setPhone(PhoneNumberCodec.format(identity));
        m.setIdentityKey(PhoneNumberCodec.identityKey(identity));

        if (hasChats) {
            m.setGroupIdentifier(chatIdentifier);
            m.setGroupName(blankToNull(str(rs.getObject("display_name"))));
        }

        if (fromMe) {
            m.setRead(true);
            m.setDelivered(true);
        } else {
            m.setRead(!hasIsRead || rs.getInt("is_read") == 1);
        }
        return m;
    }

    private static List<String> attachments(Connection conn, long messageRowId) throws SQLException {
        List<String> files = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(ATTACHMENT_SQL)) {
            ps.setLong(1, messageRowId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String filename = rs.getString(1);
                    if (filename != null && !filename.isBlank()) {
                        files.add(filename);
                    }
                }
            }
        }
        return files;
    }

    private static List<String> participants(Connection conn, long chatRowId) throws SQLException {
        List<String> list = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(PARTICIPANT_SQL)) {
            ps.setLong(1, chatRowId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    list.add(PhoneNumberCodec.format(rs.getString(1)));
                }
            }
        }
        return list;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
