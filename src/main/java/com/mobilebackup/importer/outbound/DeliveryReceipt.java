package com.mobilebackup.importer.outbound;

import com.mobilebackup.importer.model.ChannelKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryReceipt {
    /** 发送方给出的消息 id，可为空 */
    private String messageId;
    private ChannelKind channel;
    private Instant sentAt;
    private boolean delivered;
}
