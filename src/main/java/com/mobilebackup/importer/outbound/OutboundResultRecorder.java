package com.mobilebackup.importer.outbound;

import com.mobilebackup.importer.codec.PhoneNumberCodec;
import com.mobilebackup.importer.correlate.ReconciliationEngine;
import com.mobilebackup.importer.model.ChannelKind;
import com.mobilebackup.importer.model.ImportResult;
import com.mobilebackup.importer.model.MessageDirection;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.parser.Extraction;
import com.mobilebackup.importer.sync.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * 把外部发送方回报的结果落库为一条出站消息，会话聚合走和备份导入同一套合并逻辑。
 * 不做时间窗口去重：失败后重试成功的两次结果都要留下。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboundResultRecorder {

    private final ReconciliationEngine engine;
    private final Clock clock;

    /**
     * 调用发送方并记录结果；发送失败时记录一条 failed 消息，不向上抛。
     */
    public MessageRecord sendAndRecord(OutboundSender sender, String identity, String content) {
        try {
            DeliveryReceipt receipt = sender.send(identity, content);
            return recordDelivered(identity, content, receipt);
        } catch (SendException e) {
            log.warn("发送失败, identity={}: {}", identity, e.getMessage());
            return recordFailed(identity, content, e.getMessage());
        }
    }

    public MessageRecord recordDelivered(String identity, String content, DeliveryReceipt receipt) {
        MessageRecord m = baseRecord(identity, content);
        if (receipt != null) {
            if (receipt.getMessageId() != null && !receipt.getMessageId().isBlank()) {
                m.setId(receipt.getMessageId());
            }
            if (receipt.getChannel() != null) {
                m.setChannel(receipt.getChannel());
            }
            if (receipt.getSentAt() != null) {
                m.setTimestamp(receipt.getSentAt());
            }
            m.setDelivered(receipt.isDelivered());
        }
        record(m);
        return m;
    }

    public MessageRecord recordFailed(String identity, String content, String reason) {
        MessageRecord m = baseRecord(identity, content);
        m.setFailed(true);
        m.setDelivered(false);
        record(m);
        log.info("已记录失败的出站消息 {}: {}", m.getId(), reason);
        return m;
    }

    private MessageRecord baseRecord(String identity, String content) {
        MessageRecord m = new MessageRecord();
        m.setId("outbound:" + UUID.randomUUID());
        m.setText(content);
        m.setDirection(MessageDirection.OUTBOUND);
        m.setChannel(PhoneNumberCodec.isEmailHandle(identity) ? ChannelKind.IP_MESSAGE : ChannelKind.CARRIER_SMS);
        m.setTimestamp(clock.instant());
        m.setPhone(PhoneNumberCodec.format(identity));
        m.setIdentityKey(PhoneNumberCodec.identityKey(identity));
        m.setRead(true);
        return m;
    }

    private void record(MessageRecord m) {
        ImportResult result = engine.importOutbound(
                Extraction.of(RecordCategory.MESSAGES, Stream.of(m)), CancellationToken.none());
        if (result.getErrors() > 0) {
            log.error("出站消息落库失败 {}: {}", m.getId(), result.getErrorMessages());
        } else if (result.getUpdated() > 0) {
            log.info("出站消息 {} 已存在，更新送达状态 delivered={}, failed={}", m.getId(), m.isDelivered(), m.isFailed());
        } else if (result.getImported() == 0) {
            log.warn("出站消息 {} 已存在且状态未变，未写入", m.getId());
        }
    }
}
