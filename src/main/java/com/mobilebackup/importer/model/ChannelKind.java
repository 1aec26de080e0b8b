package com.mobilebackup.importer.model;

/**
 * 消息通道：运营商短信 / IP 消息 / 富媒体消息。
 * 备份解析只会产生前两种，RICH_MESSAGING 留给外部发送方回报的结果。
 */
public enum ChannelKind {
    CARRIER_SMS("sms"),
    IP_MESSAGE("imessage"),
    RICH_MESSAGING("rcs");

    private final String storeValue;

    ChannelKind(String storeValue) {
        this.storeValue = storeValue;
    }

    public String storeValue() {
        return storeValue;
    }

    /** service 字段只认 "iMessage"，其余一律按短信处理 */
    public static ChannelKind fromService(String service) {
        return "iMessage".equals(service) ? IP_MESSAGE : CARRIER_SMS;
    }

    public static ChannelKind fromStoreValue(String value) {
        for (ChannelKind k : values()) {
            if (k.storeValue.equals(value)) {
                return k;
            }
        }
        return CARRIER_SMS;
    }
}
