package com.mobilebackup.importer.controller;

import com.mobilebackup.importer.model.CallDirection;
import com.mobilebackup.importer.model.CallRecord;
import com.mobilebackup.importer.model.ExportFormat;
import com.mobilebackup.importer.model.PageResult;
import com.mobilebackup.importer.service.ConversationQueryService;
import com.mobilebackup.importer.service.ExportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/api/calls")
@RequiredArgsConstructor
public class CallLogController {

    private final ConversationQueryService queryService;
    private final ExportService exportService;

    /** direction: outgoing / incoming / missed，不传则不过滤 */
    @GetMapping
    public PageResult<CallRecord> calls(@RequestParam(required = false) String direction,
                                        @RequestParam(defaultValue = "0") int page,
                                        @RequestParam(required = false) Integer size) {
        CallDirection d = direction == null || direction.isBlank()
                ? null
                : CallDirection.valueOf(direction.trim().toUpperCase(Locale.ROOT));
        return queryService.listCalls(d, page, size);
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(@RequestParam(defaultValue = "csv") String format) {
        return ConversationController.download(exportService.exportCalls(ExportFormat.fromKey(format)));
    }
}
