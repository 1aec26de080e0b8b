package com.mobilebackup.importer.model;

import lombok.Data;

@Data
public class MessageStats {
    private long totalMessages;
    private long inboundMessages;
    private long outboundMessages;
    private long ipMessages;
    private long smsMessages;
    private long totalThreads;
    private long unreadMessages;
}
