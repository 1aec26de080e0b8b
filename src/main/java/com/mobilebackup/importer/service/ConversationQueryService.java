package com.mobilebackup.importer.service;

import com.mobilebackup.importer.config.ImporterProperties;
import com.mobilebackup.importer.exception.ThreadNotFoundException;
import com.mobilebackup.importer.model.CallDirection;
import com.mobilebackup.importer.model.CallRecord;
import com.mobilebackup.importer.model.ContactRecord;
import com.mobilebackup.importer.model.ConversationThread;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.model.MessageStats;
import com.mobilebackup.importer.model.PageResult;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.model.SyncHistoryEntry;
import com.mobilebackup.importer.store.CallLogRepository;
import com.mobilebackup.importer.store.ContactRepository;
import com.mobilebackup.importer.store.MessageRepository;
import com.mobilebackup.importer.store.SyncHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * 给展示层用的只读查询，外加两个会话级操作（标记已读、归档）。
 * page 从 0 开始；size 超出上限时截断。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationQueryService {

    private final MessageRepository messageRepository;
    private final CallLogRepository callLogRepository;
    private final ContactRepository contactRepository;
    private final SyncHistoryRepository historyRepository;
    private final ImporterProperties properties;
    private final Clock clock;

    /** 最近活跃在前；默认不含已归档 */
    public PageResult<ConversationThread> listThreads(int page, Integer size, boolean includeArchived) {
        int s = pageSize(size);
        int p = Math.max(page, 0);
        return new PageResult<>(messageRepository.listThreads(p * s, s, includeArchived), p, s,
                messageRepository.countThreads(includeArchived));
    }

    public ConversationThread getThread(String threadId) {
        return messageRepository.findThread(threadId).orElseThrow(() -> new ThreadNotFoundException(threadId));
    }

    /** 会话内消息按时间正序 */
    public PageResult<MessageRecord> listMessages(String threadId, int page, Integer size) {
        getThread(threadId);
        int s = pageSize(size);
        int p = Math.max(page, 0);
        return new PageResult<>(messageRepository.listMessages(threadId, p * s, s), p, s,
                messageRepository.countMessages(threadId));
    }

    /** 返回本次从未读变为已读的消息条数 */
    public int markThreadRead(String threadId) {
        getThread(threadId);
        int n = messageRepository.markThreadRead(threadId, clock.millis());
        log.info("会话 {} 标记已读: {} 条", threadId, n);
        return n;
    }

    public ConversationThread archiveThread(String threadId, boolean archived) {
        getThread(threadId);
        messageRepository.setArchived(threadId, archived, clock.millis());
        return getThread(threadId);
    }

    public List<MessageRecord> searchMessages(String query, Integer limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return messageRepository.search(query.trim(), pageSize(limit));
    }

    public MessageStats messageStats() {
        return messageRepository.stats();
    }

    public PageResult<CallRecord> listCalls(CallDirection direction, int page, Integer size) {
        int s = pageSize(size);
        int p = Math.max(page, 0);
        return new PageResult<>(callLogRepository.list(direction, p * s, s), p, s,
                callLogRepository.count(direction));
    }

    public PageResult<ContactRecord> listContacts(int page, Integer size) {
        int s = pageSize(size);
        int p = Math.max(page, 0);
        return new PageResult<>(contactRepository.list(p * s, s), p, s, contactRepository.count());
    }

    public List<SyncHistoryEntry> syncHistory(RecordCategory category, Integer limit) {
        return historyRepository.recent(category, pageSize(limit));
    }

    private int pageSize(Integer requested) {
        if (requested == null || requested <= 0) {
            return properties.getDefaultPageSize();
        }
        return Math.min(requested, properties.getMaxPageSize());
    }
}
