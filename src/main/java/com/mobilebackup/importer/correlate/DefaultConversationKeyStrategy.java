package com.mobilebackup.importer.correlate;

import com.mobilebackup.importer.codec.PhoneNumberCodec;
import com.mobilebackup.importer.model.MessageRecord;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 默认会话 key 生成策略，按优先级：
 * 1. 群聊：group:chat_identifier（没有 identifier 时用排序后的参与方列表）
 * 2. 单聊：对端身份（identityKey，纯数字号码或小写邮箱）
 * 3. 兜底：unknown
 */
@Component
public class DefaultConversationKeyStrategy implements ConversationKeyStrategy {

    @Override
    public String resolve(MessageRecord message) {
        if (message == null) {
            return "unknown";
        }

        if (message.isGroup()) {
            String identifier = firstNonBlank(message.getGroupIdentifier());
            if (identifier != null) {
                return "group:" + identifier.toLowerCase(Locale.ROOT);
            }
            if (message.getParticipants() != null && !message.getParticipants().isEmpty()) {
                return "group:" + String.join(",", message.getParticipants().stream()
                        .map(PhoneNumberCodec::identityKey)
                        .sorted()
                        .toList());
            }
        }

        String identity = firstNonBlank(message.getIdentityKey());
        if (identity != null && !PhoneNumberCodec.UNKNOWN.equals(identity)) {
            return identity;
        }

        return "unknown";
    }

    private String firstNonBlank(String... values) {
        if (values == null) return null;
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}
