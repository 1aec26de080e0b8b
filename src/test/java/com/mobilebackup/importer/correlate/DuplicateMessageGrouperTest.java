package com.mobilebackup.importer.correlate;

import com.mobilebackup.importer.model.MessageRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DuplicateMessageGrouperTest {

    private final DuplicateMessageGrouper grouper = new DuplicateMessageGrouper();

    private static MessageRecord m(String id, String identity, String text, long epochSecond) {
        MessageRecord r = new MessageRecord();
        r.setId(id);
        r.setIdentityKey(identity);
        r.setText(text);
        r.setTimestamp(Instant.ofEpochSecond(epochSecond));
        return r;
    }

    @Test
    void keepsEarliestOfEachGroup() {
        List<MessageRecord> all = List.of(
                m("late", "9415180701", "hello  there", 500),
                m("early", "9415180701", "hello there", 100),
                m("other", "4155550123", "hello there", 100),
                m("same-time-b", "4155550123", "ok", 50),
                m("same-time-a", "4155550123", " ok", 50));

        Map<String, List<MessageRecord>> groups = grouper.groupDuplicates(all);

        assertEquals(2, groups.size());
        assertThat(grouper.redundant(groups)).extracting(MessageRecord::getId)
                .containsExactlyInAnyOrder("late", "same-time-b");
    }

    @Test
    void singletonsAreNotGroups() {
        assertTrue(grouper.groupDuplicates(List.of(m("a", "1", "x", 1), m("b", "2", "x", 1))).isEmpty());
        assertTrue(grouper.groupDuplicates(List.of()).isEmpty());
        assertTrue(grouper.groupDuplicates(null).isEmpty());
    }
}
