package com.mobilebackup.importer.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobilebackup.importer.codec.PhoneNumberCodec;
import com.mobilebackup.importer.model.ContactRecord;
import com.mobilebackup.importer.model.LabeledValue;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class ContactRepository {

    private final JdbcTemplate jdbc;
    private final JsonColumns json;

    private final RowMapper<ContactRecord> contactMapper = this::mapContact;

    public ContactRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumns(objectMapper);
    }

    private ContactRecord mapContact(ResultSet rs, int rowNum) throws SQLException {
        ContactRecord c = new ContactRecord();
        c.setId(rs.getString("id"));
        c.setGivenName(rs.getString("given_name"));
        c.setFamilyName(rs.getString("family_name"));
        c.setOrganization(rs.getString("organization"));
        c.setNotes(rs.getString("notes"));
        c.setPhones(json.readLabeled(rs.getString("phones_json")));
        c.setEmails(json.readLabeled(rs.getString("emails_json")));
        return c;
    }

    public Optional<ContactRecord> findById(String id) {
        return jdbc.query("SELECT * FROM contacts WHERE id = ?", contactMapper, id).stream().findFirst();
    }

    /**
     * 插入新联系人；id 已存在时不做任何事并返回 false。
     */
    public boolean insert(ContactRecord contact, long nowMs) {
        int n = jdbc.update("""
                        INSERT INTO contacts (id, given_name, family_name, display_name, organization, notes,
                                              phones_json, emails_json, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        ON CONFLICT(id) DO NOTHING
                        """,
                contact.getId(), contact.getGivenName(), contact.getFamilyName(), contact.displayName(),
                contact.getOrganization(), contact.getNotes(),
                json.write(contact.getPhones()), json.write(contact.getEmails()), nowMs, nowMs);
        if (n > 0) {
            replaceIdentities(contact);
        }
        return n > 0;
    }

    public void update(ContactRecord contact, long nowMs) {
        jdbc.update("""
                        UPDATE contacts SET given_name = ?, family_name = ?, display_name = ?, organization = ?,
                                            notes = ?, phones_json = ?, emails_json = ?, updated_at = ?
                        WHERE id = ?
                        """,
                contact.getGivenName(), contact.getFamilyName(), contact.displayName(), contact.getOrganization(),
                contact.getNotes(), json.write(contact.getPhones()), json.write(contact.getEmails()), nowMs,
                contact.getId());
        replaceIdentities(contact);
    }

    /** 按归一化号码 / 邮箱找联系人，多个命中时取 id 最小的 */
    public Optional<String> findIdByIdentity(String identityKey) {
        if (identityKey == null || PhoneNumberCodec.UNKNOWN.equals(identityKey)) {
            return Optional.empty();
        }
        return jdbc.queryForList(
                        "SELECT contact_id FROM contact_identities WHERE identity_key = ? ORDER BY contact_id LIMIT 1",
                        String.class, identityKey)
                .stream().findFirst();
    }

    public List<ContactRecord> list(int offset, int limit) {
        return jdbc.query("SELECT * FROM contacts ORDER BY display_name COLLATE NOCASE, id LIMIT ? OFFSET ?",
                contactMapper, limit, offset);
    }

    public long count() {
        Long n = jdbc.queryForObject("SELECT count(*) FROM contacts", Long.class);
        return n == null ? 0 : n;
    }

    private void replaceIdentities(ContactRecord contact) {
        jdbc.update("DELETE FROM contact_identities WHERE contact_id = ?", contact.getId());
        Set<String> keys = new LinkedHashSet<>();
        for (LabeledValue p : contact.getPhones()) {
            keys.add(PhoneNumberCodec.identityKey(p.getValue()));
        }
        for (LabeledValue e : contact.getEmails()) {
            keys.add(PhoneNumberCodec.identityKey(e.getValue()));
        }
        keys.remove(PhoneNumberCodec.UNKNOWN);
        for (String key : keys) {
            jdbc.update("INSERT OR IGNORE INTO contact_identities (contact_id, identity_key) VALUES (?, ?)",
                    contact.getId(), key);
        }
    }
}
