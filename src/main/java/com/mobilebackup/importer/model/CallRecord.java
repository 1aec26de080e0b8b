package com.mobilebackup.importer.model;

import lombok.Data;

import java.time.Instant;

@Data
public class CallRecord {
    private String id;
    private String phone;
    private String identityKey;
    private Instant timestamp;
    private long durationSeconds;
    private CallDirection direction;
    private CallKind kind = CallKind.VOICE;
    private String contactId;     // 导入时按号码匹配联系人
    private String contactName;   // 仅查询时回填
}
