package com.mobilebackup.importer.correlate;

import com.mobilebackup.importer.model.MessageRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 决定“这条消息属于哪个会话”的策略。
 * 会话 key 由参与方身份推导，不使用源库主键。
 */
public interface ConversationKeyStrategy {

    /**
     * 返回会话 key；不会返回 null，无法识别时返回 "unknown"。
     */
    String resolve(MessageRecord message);

    /**
     * 会话 key → 会话 id（thread-xxx）。只保留字母数字，
     * 所以不同的 key 可能得到同一个 id，调用方需要用 {@link #disambiguatedThreadId} 兜底。
     */
    default String threadId(String conversationKey) {
        String sanitized = conversationKey == null ? "" : conversationKey.replaceAll("[^a-zA-Z0-9]", "");
        return "thread-" + (sanitized.isEmpty() ? "unknown" : sanitized);
    }

    /**
     * 在 {@link #threadId} 后面拼上 key 的 SHA-256 前缀。
     * hexLength 取 1..64，越长越不可能再撞。
     */
    default String disambiguatedThreadId(String conversationKey, int hexLength) {
        String key = conversationKey == null ? "" : conversationKey;
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            String hex = HexFormat.of().formatHex(hash);
            return threadId(key) + "-" + hex.substring(0, Math.max(1, Math.min(hexLength, hex.length())));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
