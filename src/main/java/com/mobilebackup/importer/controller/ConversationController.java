package com.mobilebackup.importer.controller;

import com.mobilebackup.importer.model.ConversationThread;
import com.mobilebackup.importer.model.ExportDocument;
import com.mobilebackup.importer.model.ExportFormat;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.model.MessageStats;
import com.mobilebackup.importer.model.PageResult;
import com.mobilebackup.importer.service.ConversationQueryService;
import com.mobilebackup.importer.service.ExportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationQueryService queryService;
    private final ExportService exportService;

    @GetMapping("/threads")
    public PageResult<ConversationThread> threads(@RequestParam(defaultValue = "0") int page,
                                                  @RequestParam(required = false) Integer size,
                                                  @RequestParam(defaultValue = "false") boolean includeArchived) {
        return queryService.listThreads(page, size, includeArchived);
    }

    @GetMapping("/threads/{id}/messages")
    public PageResult<MessageRecord> messages(@PathVariable String id,
                                              @RequestParam(defaultValue = "0") int page,
                                              @RequestParam(required = false) Integer size) {
        return queryService.listMessages(id, page, size);
    }

    @PostMapping("/threads/{id}/read")
    public Map<String, Object> markRead(@PathVariable String id) {
        return Map.of("threadId", id, "marked", queryService.markThreadRead(id));
    }

    @PostMapping("/threads/{id}/archive")
    public ConversationThread archive(@PathVariable String id,
                                      @RequestParam(defaultValue = "true") boolean archived) {
        return queryService.archiveThread(id, archived);
    }

    @GetMapping("/threads/{id}/export")
    public ResponseEntity<String> export(@PathVariable String id,
                                         @RequestParam(defaultValue = "csv") String format) {
        return download(exportService.exportThread(id, ExportFormat.fromKey(format)));
    }

    @GetMapping("/messages/search")
    public List<MessageRecord> search(@RequestParam("q") String query,
                                      @RequestParam(required = false) Integer limit) {
        return queryService.searchMessages(query, limit);
    }

    @GetMapping("/messages/stats")
    public MessageStats stats() {
        return queryService.messageStats();
    }

    static ResponseEntity<String> download(ExportDocument doc) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + doc.getFileName() + "\"")
                .contentType(MediaType.parseMediaType(doc.getFormat().contentType() + ";charset=UTF-8"))
                .body(doc.getContent());
    }
}
