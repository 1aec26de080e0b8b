package com.mobilebackup.importer.correlate;

import com.mobilebackup.importer.codec.DedupSignature;
import com.mobilebackup.importer.model.MessageRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 已入库消息的重复分组：同一身份 + 同一归一化内容归为一桶。
 * 桶内按时间升序，第一条保留，其余都是要删除的重复。
 *
 * 和导入时的窗口去重不同，这里不看时间差，用于事后紧急清理。
 */
public class DuplicateMessageGrouper {

    /**
     * 只返回真正重复的桶（size > 1），key 为去重签名。
     */
    public Map<String, List<MessageRecord>> groupDuplicates(List<MessageRecord> messages) {
        Map<String, List<MessageRecord>> buckets = new LinkedHashMap<>();
        if (messages == null || messages.isEmpty()) {
            return buckets;
        }

        for (MessageRecord m : messages) {
            String signature = DedupSignature.of(m.getIdentityKey(), m.getText());
            buckets.computeIfAbsent(signature, k -> new ArrayList<>()).add(m);
        }

        buckets.values().removeIf(list -> list.size() < 2);
        // 时间相同的按 id 排，保证每次挑出同一条保留
        Comparator<MessageRecord> order = Comparator
                .comparing(MessageRecord::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(MessageRecord::getId);
        buckets.values().forEach(list -> list.sort(order));
        return buckets;
    }

    /** 每个桶除第一条以外的消息 */
    public List<MessageRecord> redundant(Map<String, List<MessageRecord>> groups) {
        List<MessageRecord> out = new ArrayList<>();
        for (List<MessageRecord> group : groups.values()) {
            out.addAll(group.subList(1, group.size()));
        }
        return out;
    }
}
