package com.mobilebackup.importer.correlate;

import com.mobilebackup.importer.codec.DedupSignature;
import com.mobilebackup.importer.codec.PhoneNumberCodec;
import com.mobilebackup.importer.config.ImporterProperties;
import com.mobilebackup.importer.model.CallRecord;
import com.mobilebackup.importer.model.CleanupReport;
import com.mobilebackup.importer.model.ContactRecord;
import com.mobilebackup.importer.model.ImportResult;
import com.mobilebackup.importer.model.LabeledValue;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.parser.Extraction;
import com.mobilebackup.importer.store.CallLogRepository;
import com.mobilebackup.importer.store.ContactRepository;
import com.mobilebackup.importer.store.MessageRepository;
import com.mobilebackup.importer.sync.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 把提取器产出的记录合并进本地库。
 *
 * 规则：
 * - 源 id 已存在 → 跳过（联系人内容有变化时合并并记为 updated）
 * - 消息：同会话 + 同签名 + 时间差在去重窗口内 → 跳过
 * - 每条记录一个事务；取消后已提交的记录保留
 * - 无论正常结束、取消还是异常，最后都对本次触达的会话重算聚合
 */
@Component
@Slf4j
public class ReconciliationEngine {

    private enum Outcome {
        IMPORTED,
        UPDATED,
        SKIPPED
    }

    private final ContactRepository contacts;
    private final MessageRepository messages;
    private final CallLogRepository calls;
    private final ConversationKeyStrategy keyStrategy;
    private final TransactionTemplate tx;
    private final ImporterProperties properties;
    private final Clock clock;
    private final DuplicateMessageGrouper grouper = new DuplicateMessageGrouper();

    public ReconciliationEngine(ContactRepository contacts,
                                MessageRepository messages,
                                CallLogRepository calls,
                                ConversationKeyStrategy keyStrategy,
                                TransactionTemplate tx,
                                ImporterProperties properties,
                                Clock clock) {
        this.contacts = contacts;
        this.messages = messages;
        this.calls = calls;
        this.keyStrategy = keyStrategy;
        this.tx = tx;
        this.properties = properties;
        this.clock = clock;
    }

    // 三个入口都会在消费完后关闭 extraction

    public ImportResult importContacts(Extraction<ContactRecord> extraction, CancellationToken token) {
        return run(extraction, token, this::reconcileContact, c -> "contact " + c.getId());
    }

    public ImportResult importMessages(Extraction<MessageRecord> extraction, CancellationToken token) {
        return run(extraction, token, this::reconcileMessage, m -> "message " + m.getId());
    }

    public ImportResult importOutbound(Extraction<MessageRecord> extraction, CancellationToken token) {
        return run(extraction, token, this::reconcileOutbound, m -> "outbound message " + m.getId());
    }

    public ImportResult importCalls(Extraction<CallRecord> extraction, CancellationToken token) {
        return run(extraction, token, this::reconcileCall, c -> "call " + c.getId());
    }

    private <T> ImportResult run(Extraction<T> extraction,
                                 CancellationToken token,
                                 BiFunction<T, ImportResult, Outcome> reconcile,
                                 Function<T, String> describe) {
        RecordCategory category = extraction.getCategory();
        ImportResult result = ImportResult.of(category);
        result.setSourcePresent(extraction.isSourcePresent());
        CancellationToken cancel = token == null ? CancellationToken.none() : token;

        try (extraction) {
            Iterator<T> it = extraction.getRecords().iterator();
            while (it.hasNext()) {
                if (cancel.isCancelled()) {
                    result.setCancelled(true);
                    break;
                }
                T record = it.next();
                try {
                    Outcome outcome = tx.execute(status -> reconcile.apply(record, result));
                    count(result, outcome);
                } catch (RuntimeException e) {
                    log.warn("{} 入库失败: {}", describe.apply(record), e.getMessage());
                    result.addError(describe.apply(record) + ": " + e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            log.error("{} 导入中断", category.key(), e);
            result.addError(category.key() + " import aborted: " + e.getMessage());
        } finally {
            if (extraction.isCancelled()) {
                result.setCancelled(true);
            }
            synchronized (extraction.getDecodeErrors()) {
                extraction.getDecodeErrors().forEach(result::addError);
            }
            synchronized (extraction.getWarnings()) {
                extraction.getWarnings().forEach(result::addWarning);
            }
            if (!result.getTouchedThreadIds().isEmpty()) {
                recomputeTouchedThreads(result);
            }
        }

        log.info("{} 导入完成: imported={}, updated={}, skipped={}, errors={}, cancelled={}",
                category.key(), result.getImported(), result.getUpdated(), result.getSkipped(),
                result.getErrors(), result.isCancelled());
        return result;
    }

    private void count(ImportResult result, Outcome outcome) {
        if (outcome == null) {
            return;
        }
        switch (outcome) {
            case IMPORTED -> result.setImported(result.getImported() + 1);
            case UPDATED -> result.setUpdated(result.getUpdated() + 1);
            case SKIPPED -> result.setSkipped(result.getSkipped() + 1);
        }
    }

    private void recomputeTouchedThreads(ImportResult result) {
        try {
            Integer n = tx.execute(status ->
                    messages.recomputeThreads(result.getTouchedThreadIds(), clock.millis()));
            log.debug("重算会话聚合: {} 个", n);
        } catch (RuntimeException e) {
            log.error("会话聚合重算失败, threads={}", result.getTouchedThreadIds().size(), e);
            result.addError("thread recompute failed: " + e.getMessage());
        }
    }

    // ===== contacts =====

    private Outcome reconcileContact(ContactRecord incoming, ImportResult result) {
        long now = clock.millis();
        Optional<ContactRecord> existing = contacts.findById(incoming.getId());
        if (existing.isEmpty()) {
            if (!contacts.insert(incoming, now)) {
                return Outcome.SKIPPED;
            }
            linkContact(incoming, now);
            return Outcome.IMPORTED;
        }

        ContactRecord merged = merge(existing.get(), incoming);
        if (merged.equals(existing.get())) {
            log.debug("联系人 {} 无变化，跳过", incoming.getId());
            return Outcome.SKIPPED;
        }
        contacts.update(merged, now);
        linkContact(merged, now);
        return Outcome.UPDATED;
    }

    /**
     * 新值覆盖非空字段；号码和邮箱按身份取并集，已有的在前。
     */
    static ContactRecord merge(ContactRecord existing, ContactRecord incoming) {
        ContactRecord m = new ContactRecord();
        m.setId(existing.getId());
        m.setGivenName(prefer(incoming.getGivenName(), existing.getGivenName()));
        m.setFamilyName(prefer(incoming.getFamilyName(), existing.getFamilyName()));
        m.setOrganization(prefer(incoming.getOrganization(), existing.getOrganization()));
        m.setNotes(prefer(incoming.getNotes(), existing.getNotes()));
        m.setPhones(union(existing.getPhones(), incoming.getPhones()));
        m.setEmails(union(existing.getEmails(), incoming.getEmails()));
        return m;
    }

    private static String prefer(String incoming, String existing) {
        return incoming != null && !incoming.isBlank() ? incoming : existing;
    }

    private static List<LabeledValue> union(List<LabeledValue> existing, List<LabeledValue> incoming) {
        List<LabeledValue> out = new ArrayList<>(existing);
        Set<String> seen = new LinkedHashSet<>();
        existing.forEach(v -> seen.add(PhoneNumberCodec.identityKey(v.getValue())));
        for (LabeledValue v : incoming) {
            if (seen.add(PhoneNumberCodec.identityKey(v.getValue()))) {
                out.add(v);
            }
        }
        return out;
    }

    /** 之前导入的会话 / 通话还没挂联系人的，按身份补上 */
    private void linkContact(ContactRecord contact, long now) {
        Set<String> keys = new LinkedHashSet<>();
        contact.getPhones().forEach(p -> keys.add(PhoneNumberCodec.identityKey(p.getValue())));
        contact.getEmails().forEach(e -> keys.add(PhoneNumberCodec.identityKey(e.getValue())));
        keys.remove(PhoneNumberCodec.UNKNOWN);
        if (keys.isEmpty()) {
            return;
        }
        messages.linkThreadsToContact(contact.getId(), keys, now);
        keys.forEach(k -> calls.linkToContact(contact.getId(), k));
    }

    // ===== messages =====

    private Outcome reconcileMessage(MessageRecord m, ImportResult result) {
        Objects.requireNonNull(m.getTimestamp(), "message timestamp");
        if (messages.exists(m.getId())) {
            return Outcome.SKIPPED;
        }
        return storeMessage(m, result, true);
    }

    /**
     * 外部发送结果：失败后重试成功是两条真实记录，不做窗口去重；
     * 同一 id 再次回报时只更新送达 / 失败状态。
     */
    private Outcome reconcileOutbound(MessageRecord m, ImportResult result) {
        Objects.requireNonNull(m.getTimestamp(), "message timestamp");
        if (messages.exists(m.getId())) {
            return messages.updateDeliveryStatus(m.getId(), m.isDelivered(), m.isFailed()) > 0
                    ? Outcome.UPDATED
                    : Outcome.SKIPPED;
        }
        return storeMessage(m, result, false);
    }

    private Outcome storeMessage(MessageRecord m, ImportResult result, boolean windowDedup) {
        String key = keyStrategy.resolve(m);
        m.setConversationKey(key);
        m.setThreadId(resolveThreadId(key));

        String signature = DedupSignature.of(m.getIdentityKey(), m.getText());
        if (windowDedup
                && messages.hasSignatureWithin(m.getThreadId(), signature, m.getTimestamp(), dedupWindow().toMillis())) {
            log.debug("消息 {} 在去重窗口内重复，跳过", m.getId());
            return Outcome.SKIPPED;
        }

        long now = clock.millis();
        String contactId = m.isGroup() ? null : contacts.findIdByIdentity(m.getIdentityKey()).orElse(null);
        messages.createThreadIfAbsent(m, contactId, now);
        if (!messages.insertMessage(m, signature, now)) {
            return Outcome.SKIPPED;
        }
        messages.applyMessageToThread(m, now);
        result.getTouchedThreadIds().add(m.getThreadId());
        return Outcome.IMPORTED;
    }

    /**
     * 已有会话按 conversation_key 取回原 id；新会话的 id 若已被别的 key 占用，
     * 追加 key 摘要后缀，保证一个 id 只对应一组参与方。
     */
    private String resolveThreadId(String key) {
        Optional<String> existing = messages.findThreadIdByKey(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        String id = keyStrategy.threadId(key);
        if (!messages.threadIdExists(id)) {
            return id;
        }
        String shortId = keyStrategy.disambiguatedThreadId(key, 12);
        if (!messages.threadIdExists(shortId)) {
            log.debug("会话 id {} 已被其他 key 占用，{} 改用 {}", id, key, shortId);
            return shortId;
        }
        return keyStrategy.disambiguatedThreadId(key, 64);
    }

    private Duration dedupWindow() {
        Duration window = properties.getDedupWindow();
        if (window == null) {
            throw new IllegalStateException("importer.dedup-window is not configured");
        }
        return window;
    }

    // ===== calls =====

    private Outcome reconcileCall(CallRecord call, ImportResult result) {
        Objects.requireNonNull(call.getTimestamp(), "call timestamp");
        if (calls.exists(call.getId())) {
            return Outcome.SKIPPED;
        }
        call.setContactId(contacts.findIdByIdentity(call.getIdentityKey()).orElse(null));
        return calls.insert(call, clock.millis()) ? Outcome.IMPORTED : Outcome.SKIPPED;
    }

    // ===== cleanup =====

    /**
     * 紧急清理：按 (身份, 归一化内容) 分组，每组保留最早一条，其余连同附件删除；
     * 然后重算受影响会话、删除空会话和孤儿消息。
     */
    public CleanupReport cleanupDuplicates() {
        long started = clock.millis();
        CleanupReport report = new CleanupReport();

        Map<String, List<MessageRecord>> groups = grouper.groupDuplicates(messages.listAllForDedup());
        List<MessageRecord> redundant = grouper.redundant(groups);
        report.setDuplicateGroups(groups.size());

        Set<String> affectedThreads = new LinkedHashSet<>();
        List<String> ids = new ArrayList<>(redundant.size());
        for (MessageRecord m : redundant) {
            ids.add(m.getId());
            affectedThreads.add(m.getThreadId());
        }

        tx.executeWithoutResult(status -> {
            report.setMessagesRemoved(messages.deleteMessages(ids));
            report.setOrphanedMessagesRemoved(messages.deleteOrphanedMessages());
            report.setThreadsRecomputed(messages.recomputeThreads(affectedThreads, clock.millis()));
            report.setEmptyThreadsRemoved(messages.deleteEmptyThreads());
        });

        report.setDurationMs(clock.millis() - started);
        log.info("紧急清理完成: groups={}, removed={}, orphans={}, emptyThreads={}, {}ms",
                report.getDuplicateGroups(), report.getMessagesRemoved(), report.getOrphanedMessagesRemoved(),
                report.getEmptyThreadsRemoved(), report.getDurationMs());
        return report;
    }
}
