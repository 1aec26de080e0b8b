package com.mobilebackup.importer.parser;

import com.mobilebackup.importer.model.RecordCategory;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * 一次提取的产物。records 是惰性、有限、只能消费一次的流；
 * 想重新遍历必须重新调用提取器。关闭流即关闭底层内嵌库。
 *
 * decodeErrors 在消费 records 的过程中逐步填充。
 */
@Getter
public class Extraction<T> implements AutoCloseable {

    private final RecordCategory category;
    private final Stream<T> records;
    private final boolean sourcePresent;
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
    private final List<String> decodeErrors = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean cancelled;

    Extraction(RecordCategory category, Stream<T> records, boolean sourcePresent) {
        this.category = category;
        this.records = records;
        this.sourcePresent = sourcePresent;
    }

    /** 源库不在备份里：空结果 + SourceNotPresent 警告，不是致命错误 */
    public static <T> Extraction<T> notPresent(RecordCategory category, String fileName) {
        Extraction<T> e = new Extraction<>(category, Stream.empty(), false);
        e.warnings.add(String.format("SourceNotPresent: %s database (%s) not found in backup",
                category.key(), fileName));
        return e;
    }

    /** 源库存在但打不开 / 已损坏：同样按该类别跳过处理 */
    public static <T> Extraction<T> unreadable(RecordCategory category, String fileName, String reason) {
        Extraction<T> e = new Extraction<>(category, Stream.empty(), true);
        e.warnings.add(String.format("SourceUnreadable: %s database (%s) could not be read: %s",
                category.key(), fileName, reason));
        return e;
    }

    /** 直接包一个已有的流，给外部回报结果、测试等场景用 */
    public static <T> Extraction<T> of(RecordCategory category, Stream<T> records) {
        return new Extraction<>(category, records, true);
    }

    void markCancelled() {
        this.cancelled = true;
    }

    @Override
    public void close() {
        records.close();
    }
}
