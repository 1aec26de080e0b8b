package com.mobilebackup.importer.model;

public enum MessageDirection {
    INBOUND,
    OUTBOUND;

    public static MessageDirection fromMe(boolean fromMe) {
        return fromMe ? OUTBOUND : INBOUND;
    }
}
