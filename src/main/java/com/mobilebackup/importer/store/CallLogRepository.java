package com.mobilebackup.importer.store;

import com.mobilebackup.importer.model.CallDirection;
import com.mobilebackup.importer.model.CallKind;
import com.mobilebackup.importer.model.CallRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class CallLogRepository {

    private static final String CALL_SELECT = """
            SELECT l.*, c.display_name AS contact_name
            FROM call_logs l
            LEFT JOIN contacts c ON c.id = l.contact_id
            """;

    private static final RowMapper<CallRecord> CALL_MAPPER = (rs, i) -> {
        CallRecord c = new CallRecord();
        c.setId(rs.getString("id"));
        c.setPhone(rs.getString("phone"));
        c.setIdentityKey(rs.getString("identity_key"));
        c.setContactId(rs.getString("contact_id"));
        c.setContactName(rs.getString("contact_name"));
        c.setDirection(CallDirection.valueOf(rs.getString("direction")));
        c.setKind(CallKind.valueOf(rs.getString("call_kind")));
        c.setDurationSeconds(rs.getLong("duration"));
        c.setTimestamp(Instant.ofEpochMilli(rs.getLong("start_time")));
        return c;
    };

    private final JdbcTemplate jdbc;

    public boolean exists(String callId) {
        Integer n = jdbc.queryForObject("SELECT count(*) FROM call_logs WHERE id = ?", Integer.class, callId);
        return n != null && n > 0;
    }

    /** id 冲突返回 false */
    public boolean insert(CallRecord call, long nowMs) {
        return jdbc.update("""
                        INSERT INTO call_logs (id, phone, identity_key, contact_id, direction, call_kind,
                                               duration, start_time, created_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                        ON CONFLICT(id) DO NOTHING
                        """,
                call.getId(), call.getPhone(), call.getIdentityKey(), call.getContactId(),
                call.getDirection().name(), call.getKind().name(), call.getDurationSeconds(),
                call.getTimestamp().toEpochMilli(), nowMs) > 0;
    }

    /**
     * 按开始时间倒序分页；direction 为 null 时不过滤。
     */
    public List<CallRecord> list(CallDirection direction, int offset, int limit) {
        List<Object> args = new ArrayList<>();
        String where = "";
        if (direction != null) {
            where = " WHERE l.direction = ?";
            args.add(direction.name());
        }
        args.add(limit);
        args.add(offset);
        return jdbc.query(CALL_SELECT + where + " ORDER BY l.start_time DESC, l.id LIMIT ? OFFSET ?",
                CALL_MAPPER, args.toArray());
    }

    public long count(CallDirection direction) {
        Long n = direction == null
                ? jdbc.queryForObject("SELECT count(*) FROM call_logs", Long.class)
                : jdbc.queryForObject("SELECT count(*) FROM call_logs WHERE direction = ?", Long.class,
                direction.name());
        return n == null ? 0 : n;
    }

    /** 导出用：全部通话，时间倒序 */
    public List<CallRecord> listAll() {
        return jdbc.query(CALL_SELECT + " ORDER BY l.start_time DESC, l.id", CALL_MAPPER);
    }

    /** 联系人导入后补关联 */
    public int linkToContact(String contactId, String identityKey) {
        return jdbc.update("UPDATE call_logs SET contact_id = ? WHERE contact_id IS NULL AND identity_key = ?",
                contactId, identityKey);
    }
}
