package com.mobilebackup.importer.store;

import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.model.SyncHistoryEntry;
import com.mobilebackup.importer.support.StoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SyncHistoryRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path storeDir;

    private SyncHistoryRepository history;

    @BeforeEach
    void setUp() {
        history = new StoreFixture(storeDir).history;
    }

    @Test
    void runningRowIsFinishedInPlace() {
        long id = history.start(RecordCategory.MESSAGES, "/backups/a", T0);

        SyncHistoryEntry running = history.recent(RecordCategory.MESSAGES, 10).get(0);
        assertEquals("RUNNING", running.getStatus());
        assertNull(running.getFinishedAt());

        history.finish(id, "PARTIAL", T0.plusSeconds(5), 10, 2, 1, "row 3 broken");

        SyncHistoryEntry done = history.recent(RecordCategory.MESSAGES, 10).get(0);
        assertEquals(id, done.getId());
        assertEquals("PARTIAL", done.getStatus());
        assertEquals(T0.plusSeconds(5), done.getFinishedAt());
        assertEquals(10, done.getImported());
        assertEquals("row 3 broken", done.getErrorMessage());
    }

    @Test
    void recentIsNewestFirstAndFiltersByCategory() {
        long first = history.start(RecordCategory.CONTACTS, "/b", T0);
        long second = history.start(RecordCategory.CALLS, "/b", T0.plusSeconds(60));
        history.start(RecordCategory.CALLS, "/b", T0.plusSeconds(120));
        assertNotEquals(first, second);

        List<SyncHistoryEntry> all = history.recent(null, 10);
        assertThat(all).extracting(SyncHistoryEntry::getCategory)
                .containsExactly(RecordCategory.CALLS, RecordCategory.CALLS, RecordCategory.CONTACTS);
        assertEquals(2, history.recent(RecordCategory.CALLS, 10).size());
        assertEquals(1, history.recent(null, 1).size());
    }
}
