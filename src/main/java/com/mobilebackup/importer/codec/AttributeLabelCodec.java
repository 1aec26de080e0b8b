package com.mobilebackup.importer.codec;

import java.util.Map;

/**
 * ABMultiValue.label 整数到人类可读标签的映射，未知值一律 other。
 */
public final class AttributeLabelCodec {

    /** ABMultiValue.property：电话 */
    public static final int PROPERTY_PHONE = 3;
    /** ABMultiValue.property：邮箱 */
    public static final int PROPERTY_EMAIL = 4;

    private static final String FALLBACK = "other";

    private static final Map<Integer, String> PHONE_LABELS = Map.of(
            1, "mobile",
            2, "home",
            3, "work",
            4, "main",
            5, "home fax",
            6, "work fax",
            7, "pager",
            8, "other"
    );

    private static final Map<Integer, String> EMAIL_LABELS = Map.of(
            1, "home",
            2, "work",
            3, "other"
    );

    private AttributeLabelCodec() {
    }

    public static String phoneLabel(Integer code) {
        return code == null ? FALLBACK : PHONE_LABELS.getOrDefault(code, FALLBACK);
    }

    public static String emailLabel(Integer code) {
        return code == null ? FALLBACK : EMAIL_LABELS.getOrDefault(code, FALLBACK);
    }
}
