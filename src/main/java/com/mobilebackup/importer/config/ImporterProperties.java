package com.mobilebackup.importer.config;

import com.mobilebackup.importer.model.RecordCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * importer.* 配置。
 */
@Data
@ConfigurationProperties(prefix = "importer")
public class ImporterProperties {

    /** 备份根目录下的索引文件名 */
    private String manifestFileName = "Manifest.db";

    /**
     * 消息去重窗口：同会话、同签名、时间差不超过该值的消息视为重复。
     * 不在代码里给默认值，由 application.yml 决定。
     */
    private Duration dedupWindow;

    /** 每个类别独立的冷却时间 */
    private Map<RecordCategory, Duration> cooldowns = new EnumMap<>(RecordCategory.class);

    /** 紧急模式下冷却时间的放大倍数 */
    private int emergencyCooldownMultiplier = 10;

    /** 消息总数单次增长超过该值时打告警 */
    private int messageSpikeThreshold = 100;

    private int defaultPageSize = 50;
    private int maxPageSize = 500;

    public Duration cooldownFor(RecordCategory category) {
        Duration d = cooldowns.get(category);
        return d == null ? Duration.ZERO : d;
    }
}
