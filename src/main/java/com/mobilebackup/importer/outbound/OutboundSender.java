package com.mobilebackup.importer.outbound;

/**
 * 外部发送方的契约。本项目不驱动任何设备，只消费发送结果。
 */
public interface OutboundSender {

    /**
     * @param identity 对端号码或邮箱
     * @param content  消息正文
     * @throws SendException 发送失败（结果仍会被记录为 failed）
     */
    DeliveryReceipt send(String identity, String content) throws SendException;
}
