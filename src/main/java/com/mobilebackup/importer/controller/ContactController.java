package com.mobilebackup.importer.controller;

import com.mobilebackup.importer.model.ContactRecord;
import com.mobilebackup.importer.model.PageResult;
import com.mobilebackup.importer.service.ConversationQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/contacts")
@RequiredArgsConstructor
public class ContactController {

    private final ConversationQueryService queryService;

    @GetMapping
    public PageResult<ContactRecord> contacts(@RequestParam(defaultValue = "0") int page,
                                              @RequestParam(required = false) Integer size) {
        return queryService.listContacts(page, size);
    }
}
