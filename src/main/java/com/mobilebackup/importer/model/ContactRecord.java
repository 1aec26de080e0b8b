package com.mobilebackup.importer.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ContactRecord {

    /** 源库主键（ABPerson.ROWID） */
    private String id;

    private String givenName;
    private String familyName;

    private List<LabeledValue> phones = new ArrayList<>();
    private List<LabeledValue> emails = new ArrayList<>();

    private String organization;
    private String notes;

    /** 名 + 姓；都为空时退回到公司名，再不行就是 Unknown */
    public String displayName() {
        String name = ((givenName == null ? "" : givenName) + " " + (familyName == null ? "" : familyName)).trim();
        if (!name.isEmpty()) {
            return name;
        }
        if (organization != null && !organization.isBlank()) {
            return organization.trim();
        }
        return "Unknown";
    }
}
