package com.mobilebackup.importer.sync;

import com.mobilebackup.importer.config.ImporterProperties;
import com.mobilebackup.importer.correlate.ReconciliationEngine;
import com.mobilebackup.importer.exception.AlreadyRunningException;
import com.mobilebackup.importer.exception.CooldownActiveException;
import com.mobilebackup.importer.exception.SyncRejectedException;
import com.mobilebackup.importer.model.CleanupReport;
import com.mobilebackup.importer.model.ContactRecord;
import com.mobilebackup.importer.model.ImportResult;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.model.SyncRunReport;
import com.mobilebackup.importer.model.SyncState;
import com.mobilebackup.importer.parser.BackupContainer;
import com.mobilebackup.importer.parser.BackupContainerReader;
import com.mobilebackup.importer.parser.CallHistoryExtractor;
import com.mobilebackup.importer.parser.ContactsExtractor;
import com.mobilebackup.importer.parser.Extraction;
import com.mobilebackup.importer.parser.MessagesExtractor;
import com.mobilebackup.importer.store.MessageRepository;
import com.mobilebackup.importer.store.SyncHistoryRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 同步协调器：每个类别一个状态机 IDLE → RUNNING → COOLDOWN_WAIT → IDLE。
 *
 * - 同一类别同时只允许一次运行，RUNNING 时再次请求 → AlreadyRunning
 * - 运行结束（成功或失败）进入冷却，冷却内请求 → CooldownActive
 * - 不同类别可以并行跑
 * - 紧急清理不经过状态机
 */
@Component
@Slf4j
public class SyncCoordinator {

    /** syncAll 固定顺序：先联系人，后面的消息 / 通话才能挂上联系人 */
    private static final List<RecordCategory> SYNC_ORDER =
            List.of(RecordCategory.CONTACTS, RecordCategory.MESSAGES, RecordCategory.CALLS);

    private final BackupContainerReader containerReader;
    private final ContactsExtractor contactsExtractor;
    private final MessagesExtractor messagesExtractor;
    private final CallHistoryExtractor callHistoryExtractor;
    private final ReconciliationEngine engine;
    private final MessageRepository messageRepository;
    private final SyncHistoryRepository historyRepository;
    private final ImporterProperties properties;
    private final Clock clock;

    private final Map<RecordCategory, CategorySlot> slots = new EnumMap<>(RecordCategory.class);
    private final ScheduledExecutorService scheduler;
    private final AtomicLong lastMessageCount = new AtomicLong(-1);
    private volatile boolean emergencyMode;

    public SyncCoordinator(BackupContainerReader containerReader,
                           ContactsExtractor contactsExtractor,
                           MessagesExtractor messagesExtractor,
                           CallHistoryExtractor callHistoryExtractor,
                           ReconciliationEngine engine,
                           MessageRepository messageRepository,
                           SyncHistoryRepository historyRepository,
                           ImporterProperties properties,
                           Clock clock) {
        this.containerReader = containerReader;
        this.contactsExtractor = contactsExtractor;
        this.messagesExtractor = messagesExtractor;
        this.callHistoryExtractor = callHistoryExtractor;
        this.engine = engine;
        this.messageRepository = messageRepository;
        this.historyRepository = historyRepository;
        this.properties = properties;
        this.clock = clock;
        for (RecordCategory category : RecordCategory.values()) {
            slots.put(category, new CategorySlot());
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-cooldown");
            t.setDaemon(true);
            return t;
        });
    }

    // ===== 单类别 =====

    public ImportResult startSync(RecordCategory category, Path backupRoot) {
        return startSync(category, backupRoot, CancellationToken.none());
    }

    /**
     * 对单个类别跑一次完整导入。被拒绝时同步抛出 {@link SyncRejectedException}，不排队。
     * 容器级致命错误（索引不可用、已加密）原样抛出，类别照样进入冷却。
     */
    public ImportResult startSync(RecordCategory category, Path backupRoot, CancellationToken token) {
        acquire(category);
        long historyId = historyRepository.start(category, backupRoot.toString(), clock.instant());
        ImportResult result = null;
        String failure = null;
        try (BackupContainer container = containerReader.open(backupRoot)) {
            result = runCategory(container, category, token);
            return result;
        } catch (RuntimeException e) {
            failure = e.getMessage();
            throw e;
        } finally {
            finishHistory(historyId, result, failure);
            release(category);
        }
    }

    /**
     * 联系人单文件导入（不经过备份索引），同样受 CONTACTS 状态机约束。
     */
    public ImportResult importContactsDatabase(Path databaseFile, CancellationToken token) {
        acquire(RecordCategory.CONTACTS);
        long historyId = historyRepository.start(RecordCategory.CONTACTS, databaseFile.toString(), clock.instant());
        ImportResult result = null;
        String failure = null;
        try {
            Extraction<ContactRecord> extraction = contactsExtractor.extractFromDatabase(databaseFile, token);
            result = engine.importContacts(extraction, token);
            return result;
        } catch (RuntimeException e) {
            failure = e.getMessage();
            throw e;
        } finally {
            finishHistory(historyId, result, failure);
            release(RecordCategory.CONTACTS);
        }
    }

    // ===== 全量 =====

    public SyncRunReport syncAll(Path backupRoot) {
        return syncAll(backupRoot, CancellationToken.none());
    }

    /**
     * 依次导入联系人、消息、通话，容器只开一次。
     * 拿不到锁的类别记在 rejected 里，不影响其他类别。
     */
    public SyncRunReport syncAll(Path backupRoot, CancellationToken token) {
        SyncRunReport report = new SyncRunReport();
        report.setBackupPath(backupRoot.toString());

        Map<RecordCategory, Long> acquired = new LinkedHashMap<>();
        for (RecordCategory category : SYNC_ORDER) {
            try {
                acquire(category);
                acquired.put(category, historyRepository.start(category, backupRoot.toString(), clock.instant()));
            } catch (SyncRejectedException e) {
                report.getRejected().put(category, e.getMessage());
            }
        }
        if (acquired.isEmpty()) {
            log.warn("syncAll 所有类别都被拒绝: {}", report.getRejected());
            return report;
        }

        String fatal = null;
        try (BackupContainer container = containerReader.open(backupRoot)) {
            report.setManifest(container.getManifest());
            for (RecordCategory category : acquired.keySet()) {
                if (token.isCancelled()) {
                    ImportResult skipped = ImportResult.of(category);
                    skipped.setCancelled(true);
                    report.getResults().put(category, skipped);
                    continue;
                }
                ImportResult result = runCategory(container, category, token);
                report.getResults().put(category, result);
                result.getErrorMessages().forEach(msg -> report.getErrors().add(category.key() + ": " + msg));
            }
        } catch (RuntimeException e) {
            fatal = e.getMessage();
            report.getErrors().add(e.getMessage());
            throw e;
        } finally {
            for (Map.Entry<RecordCategory, Long> entry : acquired.entrySet()) {
                finishHistory(entry.getValue(), report.getResults().get(entry.getKey()), fatal);
                release(entry.getKey());
            }
        }

        log.info("syncAll 完成: backup={}, imported={}, rejected={}",
                backupRoot, report.totalImported(), report.getRejected().keySet());
        return report;
    }

    private ImportResult runCategory(BackupContainer container, RecordCategory category, CancellationToken token) {
        ImportResult result = switch (category) {
            case CONTACTS -> engine.importContacts(contactsExtractor.extract(container, token), token);
            case MESSAGES -> engine.importMessages(messagesExtractor.extract(container, token), token);
            case CALLS -> engine.importCalls(callHistoryExtractor.extract(container, token), token);
        };
        if (category == RecordCategory.MESSAGES) {
            recordMessageCount(messageRepository.countAllMessages());
        }
        return result;
    }

    // ===== 清理 =====

    /**
     * 紧急清理，与各类别状态无关，随时可调。
     */
    public CleanupReport emergencyCleanup() {
        log.warn("开始紧急清理重复消息");
        CleanupReport report = engine.cleanupDuplicates();
        lastMessageCount.set(messageRepository.countAllMessages());
        return report;
    }

    // ===== 监控 / 紧急模式 =====

    /**
     * 记录最新消息总数；比上次多出超过阈值时告警并返回 true。
     */
    public boolean recordMessageCount(long currentCount) {
        long previous = lastMessageCount.getAndSet(currentCount);
        if (previous >= 0 && currentCount - previous > properties.getMessageSpikeThreshold()) {
            log.warn("消息数量异常增长: {} → {} (+{})，可能存在重复导入", previous, currentCount, currentCount - previous);
            return true;
        }
        return false;
    }

    public void activateEmergencyMode() {
        emergencyMode = true;
        log.warn("紧急模式已开启，冷却时间 x{}", properties.getEmergencyCooldownMultiplier());
    }

    public void deactivateEmergencyMode() {
        emergencyMode = false;
        log.info("紧急模式已关闭");
    }

    public boolean isEmergencyMode() {
        return emergencyMode;
    }

    public Duration effectiveCooldown(RecordCategory category) {
        Duration base = properties.cooldownFor(category);
        return emergencyMode ? base.multipliedBy(properties.getEmergencyCooldownMultiplier()) : base;
    }

    public SyncState state(RecordCategory category) {
        CategorySlot slot = slots.get(category);
        synchronized (slot) {
            return slot.effectiveState(clock.instant());
        }
    }

    public Map<RecordCategory, SyncState> states() {
        Map<RecordCategory, SyncState> out = new EnumMap<>(RecordCategory.class);
        for (RecordCategory category : RecordCategory.values()) {
            out.put(category, state(category));
        }
        return out;
    }

    // ===== 状态机 =====

    private void acquire(RecordCategory category) {
        CategorySlot slot = slots.get(category);
        synchronized (slot) {
            Instant now = clock.instant();
            SyncState current = slot.effectiveState(now);
            if (current == SyncState.RUNNING) {
                log.warn("{} 正在同步，拒绝本次请求", category.key());
                throw new AlreadyRunningException(category);
            }
            if (current == SyncState.COOLDOWN_WAIT) {
                Duration remaining = Duration.between(now, slot.cooldownUntil);
                log.warn("{} 冷却中，剩余 {}s", category.key(), remaining.toSeconds());
                throw new CooldownActiveException(category, remaining);
            }
            slot.cancelIdleTask();
            slot.state = SyncState.RUNNING;
            slot.cooldownUntil = null;
        }
        log.info("{} 开始同步", category.key());
    }

    private void release(RecordCategory category) {
        CategorySlot slot = slots.get(category);
        Duration cooldown = effectiveCooldown(category);
        synchronized (slot) {
            if (cooldown.isZero() || cooldown.isNegative()) {
                slot.state = SyncState.IDLE;
                slot.cooldownUntil = null;
                return;
            }
            slot.state = SyncState.COOLDOWN_WAIT;
            slot.cooldownUntil = clock.instant().plus(cooldown);
            slot.idleTask = scheduler.schedule(() -> {
                synchronized (slot) {
                    if (slot.state == SyncState.COOLDOWN_WAIT) {
                        slot.state = SyncState.IDLE;
                    }
                }
            }, cooldown.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("{} 同步结束，冷却 {}s", category.key(), cooldown.toSeconds());
    }

    private void finishHistory(long historyId, ImportResult result, String failure) {
        String status;
        if (result == null) {
            status = "FAILED";
        } else if (result.isCancelled()) {
            status = "CANCELLED";
        } else if (result.getErrors() > 0) {
            status = "PARTIAL";
        } else {
            status = "SUCCESS";
        }
        String message = failure;
        if (message == null && result != null && !result.getErrorMessages().isEmpty()) {
            message = String.join("; ", result.getErrorMessages());
        }
        try {
            historyRepository.finish(historyId, status, clock.instant(),
                    result == null ? 0 : result.getImported() + result.getUpdated(),
                    result == null ? 0 : result.getSkipped(),
                    result == null ? 0 : result.getErrors(),
                    message);
        } catch (RuntimeException e) {
            log.error("同步历史写入失败, id={}", historyId, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    /** 单个类别的状态，所有读写都在 synchronized(slot) 内 */
    private static final class CategorySlot {
        private SyncState state = SyncState.IDLE;
        private Instant cooldownUntil;
        private ScheduledFuture<?> idleTask;

        /** 冷却到期但定时任务还没跑时，按 IDLE 算 */
        SyncState effectiveState(Instant now) {
            if (state == SyncState.COOLDOWN_WAIT && (cooldownUntil == null || !now.isBefore(cooldownUntil))) {
                return SyncState.IDLE;
            }
            return state;
        }

        void cancelIdleTask() {
            if (idleTask != null) {
                idleTask.cancel(false);
                idleTask = null;
            }
        }
    }
}
