package com.mobilebackup.importer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mobilebackup.importer.codec.PhoneNumberCodec;
import com.mobilebackup.importer.exception.ThreadNotFoundException;
import com.mobilebackup.importer.model.CallDirection;
import com.mobilebackup.importer.model.CallRecord;
import com.mobilebackup.importer.model.ExportDocument;
import com.mobilebackup.importer.model.ExportFormat;
import com.mobilebackup.importer.model.MessageDirection;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.parser.Extraction;
import com.mobilebackup.importer.support.StoreFixture;
import com.mobilebackup.importer.sync.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExportServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    @TempDir
    Path storeDir;

    private StoreFixture store;
    private ExportService exportService;

    @BeforeEach
    void setUp() {
        store = new StoreFixture(storeDir);
        exportService = new ExportService(store.messages, store.calls, store.objectMapper);

        MessageRecord in = message("m1", "Hi, \"you\" there?", T0, MessageDirection.INBOUND);
        MessageRecord out = message("m2", "yes", T0.plusSeconds(30), MessageDirection.OUTBOUND);
        store.engine.importMessages(Extraction.of(RecordCategory.MESSAGES, Stream.of(in, out)),
                CancellationToken.none());

        CallRecord call = new CallRecord();
        call.setId("1");
        call.setPhone("(941) 518-0701");
        call.setIdentityKey("9415180701");
        call.setTimestamp(T0);
        call.setDurationSeconds(3725);
        call.setDirection(CallDirection.OUTGOING);
        store.engine.importCalls(Extraction.of(RecordCategory.CALLS, Stream.of(call)), CancellationToken.none());
    }

    private static MessageRecord message(String id, String text, Instant ts, MessageDirection direction) {
        MessageRecord m = new MessageRecord();
        m.setId(id);
        m.setText(text);
        m.setTimestamp(ts);
        m.setDirection(direction);
        m.setPhone(PhoneNumberCodec.format("+19415180701"));
        m.setIdentityKey(PhoneNumberCodec.identityKey("+19415180701"));
        return m;
    }

    @Test
    void threadCsvQuotesSpecialCharacters() {
        ExportDocument doc = exportService.exportThread("thread-9415180701", ExportFormat.CSV);

        assertEquals("thread-9415180701.csv", doc.getFileName());
        assertEquals(2, doc.getRecordCount());
        String[] lines = doc.getContent().split("\n");
        assertEquals("Time,Direction,Phone,Channel,Read,Content", lines[0]);
        assertEquals("2024-05-01 08:00:00,inbound,(941) 518-0701,sms,false,\"Hi, \"\"you\"\" there?\"", lines[1]);
    }

    @Test
    void threadJsonIsArrayOfMessages() throws Exception {
        ExportDocument doc = exportService.exportThread("thread-9415180701", ExportFormat.JSON);

        JsonNode root = store.objectMapper.readTree(doc.getContent());
        assertEquals(2, root.size());
        assertEquals("m1", root.get(0).get("id").asText());
        assertEquals("2024-05-01T08:00:00Z", root.get(0).get("timestamp").asText());
    }

    @Test
    void threadTextShowsSpeakers() {
        ExportDocument doc = exportService.exportThread("thread-9415180701", ExportFormat.TXT);

        assertThat(doc.getContent())
                .contains("[2024-05-01 08:00:00] (941) 518-0701: Hi, \"you\" there?")
                .contains("[2024-05-01 08:00:30] Me: yes");
    }

    @Test
    void callsExportInAllFormats() {
        assertThat(exportService.exportCalls(ExportFormat.CSV).getContent())
                .contains("2024-05-01 08:00:00,Unknown,(941) 518-0701,outgoing,voice,1:02:05");
        assertThat(exportService.exportCalls(ExportFormat.TXT).getContent())
                .contains("OUTGOING call to (941) 518-0701 (1:02:05)");
        assertThat(exportService.exportCalls(ExportFormat.JSON).getContent()).contains("\"durationSeconds\" : 3725");
    }

    @Test
    void unknownThreadCannotBeExported() {
        assertThrows(ThreadNotFoundException.class, () -> exportService.exportThread("thread-x", ExportFormat.TXT));
    }

    @Test
    void formatHelpers() {
        assertEquals("1:30", ExportService.formatDuration(90));
        assertEquals("0:00", ExportService.formatDuration(0));
        assertEquals("plain", ExportService.csvCell("plain"));
        assertEquals("\"a\nb\"", ExportService.csvCell("a\nb"));
        assertEquals(ExportFormat.CSV, ExportFormat.fromKey(null));
        assertEquals(ExportFormat.TXT, ExportFormat.fromKey("txt"));
        assertThrows(IllegalArgumentException.class, () -> ExportFormat.fromKey("xml"));
    }
}
