package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.sync.CancellationToken;

/**
 * 记录提取器：通过容器索引找到自己的内嵌库，产出归一化记录。
 * 联系人 / 消息 / 通话三种实现形状一致。
 */
public interface RecordExtractor<T> {

    RecordCategory category();

    /** 内嵌库的知名文件名，用于后缀匹配 */
    String sourceFileName();

    /**
     * 找不到源库时返回 {@link Extraction#notPresent}，不抛异常。
     */
    Extraction<T> extract(BackupContainer container, CancellationToken token);
}
