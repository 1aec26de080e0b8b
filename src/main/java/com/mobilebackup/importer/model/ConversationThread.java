package com.mobilebackup.importer.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 会话聚合。只由 ReconciliationEngine 在导入消息时创建和维护，
 * lastMessage / lastActivity 永远对应会话里时间最新的那条消息。
 */
@Data
public class ConversationThread {
    private String id;
    private String conversationKey;
    private String phone;
    private String contactId;
    private String contactName;
    private String lastMessageId;
    private String lastMessagePreview;
    private Instant lastActivity;
    private int unreadCount;
    private int messageCount;
    private boolean group;
    private String groupName;
    private List<String> participants = new ArrayList<>();
    private boolean archived;
}
