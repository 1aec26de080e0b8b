package com.mobilebackup.importer.codec;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 号码归一化。
 * format      : 展示形式，10 位号码格式化成 (AAA) BBB-CCCC，其余长度保留纯数字
 * identityKey : 比较形式，去掉国家码 1 之后的纯数字；邮箱类 handle 统一小写
 */
public final class PhoneNumberCodec {

    public static final String UNKNOWN = "Unknown";

    private static final Pattern US_PREFIX = Pattern.compile("^\\+1");
    private static final Pattern PLUS_PREFIX = Pattern.compile("^\\+");
    private static final Pattern NON_DIGIT = Pattern.compile("[^0-9]");

    private PhoneNumberCodec() {
    }

    public static String format(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String v = raw.trim();
        if (isEmailHandle(v)) {
            return v.toLowerCase(Locale.ROOT);
        }
        String number = PLUS_PREFIX.matcher(US_PREFIX.matcher(v).replaceFirst("")).replaceFirst("");
        number = NON_DIGIT.matcher(number).replaceAll("");
        if (number.length() == 10) {
            return "(" + number.substring(0, 3) + ") " + number.substring(3, 6) + "-" + number.substring(6);
        }
        return number.isEmpty() ? UNKNOWN : number;
    }

    public static String identityKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String v = raw.trim();
        if (isEmailHandle(v)) {
            return v.toLowerCase(Locale.ROOT);
        }
        String digits = NON_DIGIT.matcher(v).replaceAll("");
        if (digits.length() == 11 && digits.startsWith("1")) {
            digits = digits.substring(1);
        }
        return digits.isEmpty() ? UNKNOWN : digits;
    }

    public static boolean isEmailHandle(String raw) {
        return raw != null && raw.indexOf('@') > 0;
    }
}
