package com.mobilebackup.importer.codec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * 去重签名：sha256(identityKey + NUL + 归一化内容)。
 * 源 id 在重新导出时不一定稳定，签名用来识别“同一个人、同一句话”。
 */
public final class DedupSignature {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DedupSignature() {
    }

    public static String of(String identityKey, String content) {
        String payload = (identityKey == null ? "" : identityKey) + '\u0000' + normalizeContent(content);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** 去首尾空白，连续空白折叠成一个空格 */
    public static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        return WHITESPACE.matcher(content.trim()).replaceAll(" ");
    }
}
