package com.mobilebackup.importer.service;

import com.mobilebackup.importer.exception.ThreadNotFoundException;
import com.mobilebackup.importer.model.CallDirection;
import com.mobilebackup.importer.model.ConversationThread;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.model.MessageStats;
import com.mobilebackup.importer.model.PageResult;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.parser.BackupContainer;
import com.mobilebackup.importer.parser.BackupContainerReader;
import com.mobilebackup.importer.parser.CallHistoryExtractor;
import com.mobilebackup.importer.parser.MessagesExtractor;
import com.mobilebackup.importer.config.ImporterProperties;
import com.mobilebackup.importer.support.BackupFixture;
import com.mobilebackup.importer.support.SampleData;
import com.mobilebackup.importer.support.StoreFixture;
import com.mobilebackup.importer.sync.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationQueryServiceTest {

    @TempDir
    Path storeDir;

    @TempDir
    Path backupRoot;

    private StoreFixture store;
    private ConversationQueryService service;

    @BeforeEach
    void setUp() {
        store = new StoreFixture(storeDir);
        BackupFixture backup = BackupFixture.create(backupRoot);
        SampleData.fillMessages(backup.smsDatabase());
        SampleData.fillCalls(backup.callHistoryDatabase(true));
        try (BackupContainer container = new BackupContainerReader(new ImporterProperties()).open(backupRoot)) {
            store.engine.importMessages(new MessagesExtractor().extract(container, CancellationToken.none()),
                    CancellationToken.none());
            store.engine.importCalls(new CallHistoryExtractor().extract(container, CancellationToken.none()),
                    CancellationToken.none());
        }
        service = new ConversationQueryService(store.messages, store.calls, store.contacts, store.history,
                store.properties, store.clock);
    }

    @Test
    void threadsAreMostRecentFirst() {
        PageResult<ConversationThread> page = service.listThreads(0, null, false);

        assertEquals(3, page.getTotal());
        assertEquals(store.properties.getDefaultPageSize(), page.getSize());
        assertThat(page.getItems()).extracting(ConversationThread::getId)
                .containsExactly("thread-bobexamplecom", "thread-groupchat123456", "thread-9415180701");
    }

    @Test
    void pageSizeIsCapped() {
        store.properties.setMaxPageSize(2);

        PageResult<ConversationThread> page = service.listThreads(0, 1000, false);

        assertEquals(2, page.getSize());
        assertEquals(2, page.getItems().size());
        assertEquals(3, page.getTotal());
    }

    @Test
    void messagesAreChronological() {
        PageResult<MessageRecord> page = service.listMessages("thread-9415180701", 0, 10);

        assertThat(page.getItems()).extracting(MessageRecord::getId).containsExactly("G1", "G2");
        assertThat(page.getItems().get(0).getAttachments()).hasSize(1);
    }

    @Test
    void unknownThreadIsNotFound() {
        assertThrows(ThreadNotFoundException.class, () -> service.listMessages("thread-nope", 0, 10));
        assertThrows(ThreadNotFoundException.class, () -> service.markThreadRead("thread-nope"));
    }

    @Test
    void markReadClearsUnread() {
        assertEquals(1, service.getThread("thread-9415180701").getUnreadCount());

        assertEquals(1, service.markThreadRead("thread-9415180701"));

        assertEquals(0, service.getThread("thread-9415180701").getUnreadCount());
        assertEquals(0, service.markThreadRead("thread-9415180701"));
    }

    @Test
    void archivedThreadsAreHiddenByDefault() {
        ConversationThread archived = service.archiveThread("thread-groupchat123456", true);

        assertTrue(archived.isArchived());
        assertEquals(2, service.listThreads(0, null, false).getTotal());
        assertEquals(3, service.listThreads(0, null, true).getTotal());
    }

    @Test
    void searchMatchesSubstring() {
        assertThat(service.searchMessages("hello", null)).extracting(MessageRecord::getId).containsExactly("G1");
        assertThat(service.searchMessages("  ", null)).isEmpty();
        assertThat(service.searchMessages("100%", null)).isEmpty();
    }

    @Test
    void statsCountDirectionsAndChannels() {
        MessageStats stats = service.messageStats();

        assertEquals(4, stats.getTotalMessages());
        assertEquals(3, stats.getInboundMessages());
        assertEquals(1, stats.getOutboundMessages());
        assertEquals(3, stats.getIpMessages());
        assertEquals(1, stats.getSmsMessages());
        assertEquals(1, stats.getUnreadMessages());
        assertEquals(3, stats.getTotalThreads());
    }

    @Test
    void callsFilterByDirection() {
        assertEquals(3, service.listCalls(null, 0, null).getTotal());
        assertEquals(1, service.listCalls(CallDirection.MISSED, 0, null).getTotal());
        assertEquals(RecordCategory.CALLS, RecordCategory.fromKey("call_log"));
    }
}
