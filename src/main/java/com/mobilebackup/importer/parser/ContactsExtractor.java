package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.codec.AttributeLabelCodec;
import com.mobilebackup.importer.model.ContactRecord;
import com.mobilebackup.importer.model.LabeledValue;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.sync.CancellationToken;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * AddressBook.sqlitedb → ContactRecord。
 * 电话、邮箱在 ABMultiValue 里，按 record_id + property（3 电话 / 4 邮箱）区分。
 */
@Component
public class ContactsExtractor extends AbstractSqliteExtractor<ContactRecord> {

    public static final String SOURCE_FILE = "AddressBook.sqlitedb";

    private static final String PERSON_SQL = """
            SELECT ROWID AS id, First, Last, Organization, Note
            FROM ABPerson
            WHERE First IS NOT NULL OR Last IS NOT NULL OR Organization IS NOT NULL
            ORDER BY ROWID
            """;

    private static final String MULTI_VALUE_SQL = """
            SELECT property, label, value
            FROM ABMultiValue
            WHERE record_id = ? AND property IN (?, ?)
            ORDER BY ROWID
            """;

    @Override
    public RecordCategory category() {
        return RecordCategory.CONTACTS;
    }

    @Override
    public String sourceFileName() {
        return SOURCE_FILE;
    }

    @Override
    protected Extraction<ContactRecord> openRows(Connection conn, CancellationToken token) throws SQLException {
        if (!EmbeddedDatabase.hasTable(conn, "ABPerson")) {
            throw new SQLException("ABPerson table missing");
        }
        boolean hasMultiValues = EmbeddedDatabase.hasTable(conn, "ABMultiValue");
        return SqliteRowStream.open(category(), conn, PERSON_SQL,
                rs -> decode(conn, rs, hasMultiValues), token);
    }

    private ContactRecord decode(Connection conn, ResultSet rs, boolean hasMultiValues) throws SQLException {
        long rowId = rs.getLong("id");

        ContactRecord c = new ContactRecord();
        c.setId(String.valueOf(rowId));
        c.setGivenName(nullToEmpty(str(rs.getObject("First"))));
        c.setFamilyName(nullToEmpty(str(rs.getObject("Last"))));
        c.setOrganization(str(rs.getObject("Organization")));
        c.setNotes(str(rs.getObject("Note")));

        if (!hasMultiValues) {
            return c;
        }

        try (PreparedStatement ps = conn.prepareStatement(MULTI_VALUE_SQL)) {
            ps.setLong(1, rowId);
            ps.setInt(2, AttributeLabelCodec.PROPERTY_PHONE);
            ps.setInt(3, AttributeLabelCodec.PROPERTY_EMAIL);
            try (ResultSet mv = ps.executeQuery()) {
                while (mv.next()) {
                    String value = str(mv.getObject("value"));
                    if (value == null || value.isBlank()) {
                        continue;
                    }
                    int property = mv.getInt("property");
                    Integer labelCode = labelCode(mv);
                    if (property == AttributeLabelCodec.PROPERTY_PHONE) {
                        c.getPhones().add(new LabeledValue(AttributeLabelCodec.phoneLabel(labelCode), value.trim()));
                    } else {
                        c.getEmails().add(new LabeledValue(AttributeLabelCodec.emailLabel(labelCode), value.trim()));
                    }
                }
            }
        }
        return c;
    }

    private static Integer labelCode(ResultSet mv) throws SQLException {
        int code = mv.getInt("label");
        return mv.wasNull() ? null : code;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
