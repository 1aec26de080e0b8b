package com.mobilebackup.importer.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 归一化后的消息。导入后除了已读/送达状态外不再修改。
 */
@Data
public class MessageRecord {

    /** 源库 guid，缺失时用 rowid:N 兜底 */
    private String id;

    /**
     * 会话 key，由参与方身份推导而来（不是源库主键）：
     * 单聊是归一化号码/邮箱，群聊是 group:chat_identifier。
     * 提取器留空，由 ConversationKeyStrategy 填充。
     */
    private String conversationKey;

    /** 所属会话 id：thread-xxx，导入时写入 */
    private String threadId;

    private String text;
    private ChannelKind channel = ChannelKind.CARRIER_SMS;
    private MessageDirection direction = MessageDirection.INBOUND;

    /** 已从厂商纪元换算成标准 Instant */
    private Instant timestamp;

    /** 展示用号码，例如 (941) 518-0701 */
    private String phone;

    /** 比较用身份：纯数字号码或小写邮箱 */
    private String identityKey;

    private List<String> attachments = new ArrayList<>();

    private boolean read;
    private boolean delivered;
    private boolean failed;

    private boolean group;
    private String groupIdentifier;
    private String groupName;
    private List<String> participants = new ArrayList<>();
}
