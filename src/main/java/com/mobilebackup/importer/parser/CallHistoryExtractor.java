package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.codec.PhoneNumberCodec;
import com.mobilebackup.importer.codec.VendorTimeCodec;
import com.mobilebackup.importer.model.CallDirection;
import com.mobilebackup.importer.model.CallKind;
import com.mobilebackup.importer.model.CallRecord;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.sync.CancellationToken;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * CallHistory.storedata → CallRecord。
 * 方向由 ZORIGINATED / ZANSWERED 两个布尔推导，时长四舍五入到秒。
 */
@Component
public class CallHistoryExtractor extends AbstractSqliteExtractor<CallRecord> {

    public static final String SOURCE_FILE = "CallHistory.storedata";

    @Override
    public RecordCategory category() {
        return RecordCategory.CALLS;
    }

    @Override
    public String sourceFileName() {
        return SOURCE_FILE;
    }

    @Override
    protected Extraction<CallRecord> openRows(Connection conn, CancellationToken token) throws SQLException {
        if (!EmbeddedDatabase.hasTable(conn, "ZCALLRECORD")) {
            throw new SQLException("ZCALLRECORD table missing");
        }
        boolean hasCallType = EmbeddedDatabase.columns(conn, "ZCALLRECORD").contains("zcalltype");

        String sql = "SELECT Z_PK AS id, ZADDRESS, ZDATE, ZDURATION, ZORIGINATED, ZANSWERED"
                + (hasCallType ? ", ZCALLTYPE" : "")
                + " FROM ZCALLRECORD ORDER BY ZDATE ASC, Z_PK ASC";

        return SqliteRowStream.open(category(), conn, sql, rs -> decode(rs, hasCallType), token);
    }

    private CallRecord decode(ResultSet rs, boolean hasCallType) throws SQLException {
        double date = rs.getDouble("ZDATE");
        if (rs.wasNull()) {
            throw new SQLException("ZDATE is null");
        }
        String address = str(rs.getObject("ZADDRESS"));

        CallRecord call = new CallRecord();
        call.setId(String.valueOf(rs.getLong("id")));
        call.setPhone(PhoneNumberCodec.format(address));
        call.setIdentityKey(PhoneNumberCodec.identityKey(address));
        call.setTimestamp(VendorTimeCodec.toInstant(date));
        call.setDurationSeconds(Math.round(rs.getDouble("ZDURATION")));
        call.setDirection(CallDirection.derive(rs.getInt("ZORIGINATED") == 1, rs.getInt("ZANSWERED") == 1));
        if (hasCallType) {
            int type = rs.getInt("ZCALLTYPE");
            call.setKind(CallKind.fromCallType(rs.wasNull() ? null : type));
        }
        return call;
    }
}
