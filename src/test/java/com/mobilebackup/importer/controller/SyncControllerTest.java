package com.mobilebackup.importer.controller;

import com.mobilebackup.importer.exception.AlreadyRunningException;
import com.mobilebackup.importer.exception.BackupEncryptedException;
import com.mobilebackup.importer.exception.CooldownActiveException;
import com.mobilebackup.importer.exception.ManifestUnavailableException;
import com.mobilebackup.importer.model.ImportResult;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.model.SyncRunReport;
import com.mobilebackup.importer.model.SyncState;
import com.mobilebackup.importer.service.ConversationQueryService;
import com.mobilebackup.importer.sync.SyncCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SyncController.class)
class SyncControllerTest {

    private static final String BODY = "{\"backupPath\":\"/backups/abc\"}";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private SyncCoordinator coordinator;

    @MockBean
    private ConversationQueryService queryService;

    @Test
    void categorySyncReturnsResult() throws Exception {
        ImportResult result = ImportResult.of(RecordCategory.CALLS);
        result.setImported(3);
        when(coordinator.startSync(RecordCategory.CALLS, Path.of("/backups/abc"))).thenReturn(result);

        mvc.perform(post("/api/sync/call_log").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported").value(3))
                .andExpect(jsonPath("$.category").value("CALLS"));
    }

    @Test
    void runningCategoryIsConflict() throws Exception {
        when(coordinator.startSync(any(), any())).thenThrow(new AlreadyRunningException(RecordCategory.MESSAGES));

        mvc.perform(post("/api/sync/messages").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_RUNNING"));
    }

    @Test
    void cooldownIsTooManyRequestsWithRetryAfter() throws Exception {
        when(coordinator.startSync(any(), any()))
                .thenThrow(new CooldownActiveException(RecordCategory.MESSAGES, Duration.ofMillis(41_200)));

        mvc.perform(post("/api/sync/messages").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(42));
    }

    @Test
    void unusableBackupIsUnprocessable() throws Exception {
        when(coordinator.syncAll(any())).thenThrow(new BackupEncryptedException("Test iPhone"));
        mvc.perform(post("/api/sync/all").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("BACKUP_ENCRYPTED"));

        when(coordinator.startSync(any(), any()))
                .thenThrow(new ManifestUnavailableException(Path.of("/backups/abc/Manifest.db"), "missing"));
        mvc.perform(post("/api/sync/contacts").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("MANIFEST_UNAVAILABLE"));
    }

    @Test
    void badInputIsBadRequest() throws Exception {
        mvc.perform(post("/api/sync/photos").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/sync/messages").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
        verifyNoInteractions(coordinator);
    }

    @Test
    void syncAllReturnsReport() throws Exception {
        SyncRunReport report = new SyncRunReport();
        report.setBackupPath("/backups/abc");
        report.getRejected().put(RecordCategory.MESSAGES, "cooling down");
        when(coordinator.syncAll(Path.of("/backups/abc"))).thenReturn(report);

        mvc.perform(post("/api/sync/all").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rejected.MESSAGES").value("cooling down"));
    }

    @Test
    void contactsFileImport() throws Exception {
        ImportResult result = ImportResult.of(RecordCategory.CONTACTS);
        result.setImported(2);
        when(coordinator.importContactsDatabase(eq(Path.of("/backups/abc")), any())).thenReturn(result);

        mvc.perform(post("/api/sync/contacts/file").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported").value(2));
    }

    @Test
    void stateListsEveryCategory() throws Exception {
        Map<RecordCategory, SyncState> states = new EnumMap<>(RecordCategory.class);
        states.put(RecordCategory.CONTACTS, SyncState.IDLE);
        states.put(RecordCategory.MESSAGES, SyncState.COOLDOWN_WAIT);
        states.put(RecordCategory.CALLS, SyncState.RUNNING);
        when(coordinator.states()).thenReturn(states);
        when(coordinator.isEmergencyMode()).thenReturn(true);

        mvc.perform(get("/api/sync/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories.messages").value("COOLDOWN_WAIT"))
                .andExpect(jsonPath("$.categories.calls").value("RUNNING"))
                .andExpect(jsonPath("$.emergencyMode").value(true));
    }

    @Test
    void emergencyModeToggle() throws Exception {
        when(coordinator.states()).thenReturn(new EnumMap<>(RecordCategory.class));

        mvc.perform(post("/api/sync/emergency-mode").param("enabled", "true")).andExpect(status().isOk());
        verify(coordinator).activateEmergencyMode();

        mvc.perform(post("/api/sync/emergency-mode").param("enabled", "false")).andExpect(status().isOk());
        verify(coordinator).deactivateEmergencyMode();
    }
}
