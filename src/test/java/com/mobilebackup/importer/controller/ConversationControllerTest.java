package com.mobilebackup.importer.controller;

import com.mobilebackup.importer.exception.ThreadNotFoundException;
import com.mobilebackup.importer.model.ConversationThread;
import com.mobilebackup.importer.model.ExportDocument;
import com.mobilebackup.importer.model.ExportFormat;
import com.mobilebackup.importer.model.PageResult;
import com.mobilebackup.importer.service.ConversationQueryService;
import com.mobilebackup.importer.service.ExportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({ConversationController.class, CallLogController.class})
class ConversationControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ConversationQueryService queryService;

    @MockBean
    private ExportService exportService;

    @Test
    void threadsArePaged() throws Exception {
        ConversationThread t = new ConversationThread();
        t.setId("thread-9415180701");
        t.setMessageCount(2);
        when(queryService.listThreads(eq(0), isNull(), eq(false)))
                .thenReturn(new PageResult<>(List.of(t), 0, 50, 1));

        mvc.perform(get("/api/threads"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id").value("thread-9415180701"))
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    void unknownThreadIsNotFound() throws Exception {
        when(queryService.listMessages(eq("thread-x"), anyInt(), isNull()))
                .thenThrow(new ThreadNotFoundException("thread-x"));
        when(queryService.markThreadRead("thread-x")).thenThrow(new ThreadNotFoundException("thread-x"));

        mvc.perform(get("/api/threads/thread-x/messages"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("THREAD_NOT_FOUND"));
        mvc.perform(post("/api/threads/thread-x/read"))
                .andExpect(status().isNotFound());
    }

    @Test
    void markReadReportsCount() throws Exception {
        when(queryService.markThreadRead("thread-1")).thenReturn(3);

        mvc.perform(post("/api/threads/thread-1/read"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.marked").value(3));
    }

    @Test
    void exportIsAttachment() throws Exception {
        when(exportService.exportThread("thread-1", ExportFormat.TXT))
                .thenReturn(new ExportDocument("thread-1.txt", ExportFormat.TXT, "hello\n", 1));

        mvc.perform(get("/api/threads/thread-1/export").param("format", "txt"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("thread-1.txt")))
                .andExpect(content().string("hello\n"));
    }

    @Test
    void unknownExportFormatIsBadRequest() throws Exception {
        mvc.perform(get("/api/calls/export").param("format", "xml"))
                .andExpect(status().isBadRequest());
    }
}
