package com.mobilebackup.importer.controller;

import com.mobilebackup.importer.model.CleanupReport;
import com.mobilebackup.importer.model.ImportResult;
import com.mobilebackup.importer.model.RecordCategory;
import com.mobilebackup.importer.model.SyncHistoryEntry;
import com.mobilebackup.importer.model.SyncRequest;
import com.mobilebackup.importer.model.SyncRunReport;
import com.mobilebackup.importer.model.SyncState;
import com.mobilebackup.importer.service.ConversationQueryService;
import com.mobilebackup.importer.sync.CancellationToken;
import com.mobilebackup.importer.sync.SyncCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sync")
@Slf4j
@RequiredArgsConstructor
public class SyncController {

    private final SyncCoordinator coordinator;
    private final ConversationQueryService queryService;

    /** 全量：联系人 → 消息 → 通话 */
    @PostMapping("/all")
    public SyncRunReport syncAll(@RequestBody SyncRequest request) {
        log.info("收到全量同步请求: {}", request.getBackupPath());
        return coordinator.syncAll(backupRoot(request));
    }

    @PostMapping("/cleanup")
    public CleanupReport cleanup() {
        return coordinator.emergencyCleanup();
    }

    @GetMapping("/state")
    public Map<String, Object> state() {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, SyncState> states = new LinkedHashMap<>();
        coordinator.states().forEach((c, s) -> states.put(c.key(), s));
        out.put("categories", states);
        out.put("emergencyMode", coordinator.isEmergencyMode());
        return out;
    }

    @PostMapping("/emergency-mode")
    public Map<String, Object> emergencyMode(@RequestParam boolean enabled) {
        if (enabled) {
            coordinator.activateEmergencyMode();
        } else {
            coordinator.deactivateEmergencyMode();
        }
        return state();
    }

    @GetMapping("/history")
    public List<SyncHistoryEntry> history(@RequestParam(required = false) String category,
                                          @RequestParam(required = false) Integer limit) {
        return queryService.syncHistory(category == null ? null : RecordCategory.fromKey(category), limit);
    }

    /** 单独导入一个通讯录库文件，backupPath 指向该文件本身 */
    @PostMapping("/contacts/file")
    public ImportResult importContactsFile(@RequestBody SyncRequest request) {
        log.info("收到通讯录文件导入请求: {}", request.getBackupPath());
        return coordinator.importContactsDatabase(backupRoot(request), CancellationToken.none());
    }

    /** 单类别：contacts / messages / calls */
    @PostMapping("/{category}")
    public ImportResult syncCategory(@PathVariable String category, @RequestBody SyncRequest request) {
        RecordCategory c = RecordCategory.fromKey(category);
        log.info("收到 {} 同步请求: {}", c.key(), request.getBackupPath());
        return coordinator.startSync(c, backupRoot(request));
    }

    private Path backupRoot(SyncRequest request) {
        if (request == null || request.getBackupPath() == null || request.getBackupPath().isBlank()) {
            throw new IllegalArgumentException("backupPath is required");
        }
        return Path.of(request.getBackupPath());
    }
}
