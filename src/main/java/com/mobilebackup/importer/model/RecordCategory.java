package com.mobilebackup.importer.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * 备份里可导入的记录大类，同时也是同步协调器的加锁粒度。
 */
public enum RecordCategory {
    CONTACTS("contacts"),
    MESSAGES("messages"),
    CALLS("calls");

    private final String key;

    RecordCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /** 兼容 "messages" / "MESSAGES" / "call_log" 这类写法 */
    public static RecordCategory fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("record category is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("call_log") || v.equals("call_logs") || v.equals("call-history")) {
            return CALLS;
        }
        return Arrays.stream(values())
                .filter(c -> c.key.equals(v) || c.name().equalsIgnoreCase(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown record category: " + value));
    }
}
