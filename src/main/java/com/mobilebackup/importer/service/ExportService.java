package com.mobilebackup.importer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mobilebackup.importer.exception.ThreadNotFoundException;
import com.mobilebackup.importer.model.CallDirection;
import com.mobilebackup.importer.model.CallRecord;
import com.mobilebackup.importer.model.ConversationThread;
import com.mobilebackup.importer.model.ExportDocument;
import com.mobilebackup.importer.model.ExportFormat;
import com.mobilebackup.importer.model.MessageDirection;
import com.mobilebackup.importer.model.MessageRecord;
import com.mobilebackup.importer.store.CallLogRepository;
import com.mobilebackup.importer.store.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 会话消息 / 通话记录导出为 CSV、JSON 或纯文本。
 * 时间一律按 UTC 输出。
 */
@Service
@Slf4j
public class ExportService {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    /** 一次导出的上限，足够覆盖单个会话 */
    private static final int MAX_THREAD_MESSAGES = 100_000;

    private final MessageRepository messageRepository;
    private final CallLogRepository callLogRepository;
    private final ObjectMapper json;

    public ExportService(MessageRepository messageRepository,
                         CallLogRepository callLogRepository,
                         ObjectMapper objectMapper) {
        this.messageRepository = messageRepository;
        this.callLogRepository = callLogRepository;
        this.json = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ExportDocument exportThread(String threadId, ExportFormat format) {
        ConversationThread thread = messageRepository.findThread(threadId)
                .orElseThrow(() -> new ThreadNotFoundException(threadId));
        List<MessageRecord> messages = messageRepository.listMessages(threadId, 0, MAX_THREAD_MESSAGES);
        String content = switch (format) {
            case JSON -> toJson(messages);
            case CSV -> messagesCsv(messages);
            case TXT -> messagesText(thread, messages);
        };
        log.info("导出会话 {}: {} 条消息, format={}", threadId, messages.size(), format);
        return new ExportDocument(threadId + "." + format.extension(), format, content, messages.size());
    }

    public ExportDocument exportCalls(ExportFormat format) {
        List<CallRecord> calls = callLogRepository.listAll();
        String content = switch (format) {
            case JSON -> toJson(calls);
            case CSV -> callsCsv(calls);
            case TXT -> callsText(calls);
        };
        log.info("导出通话记录: {} 条, format={}", calls.size(), format);
        return new ExportDocument("call-logs." + format.extension(), format, content, calls.size());
    }

    // ===== messages =====

    private String messagesCsv(List<MessageRecord> messages) {
        StringBuilder sb = new StringBuilder("Time,Direction,Phone,Channel,Read,Content\n");
        for (MessageRecord m : messages) {
            sb.append(csvRow(
                    time(m.getTimestamp()),
                    m.getDirection().name().toLowerCase(),
                    m.getPhone(),
                    m.getChannel().storeValue(),
                    String.valueOf(m.isRead()),
                    m.getText()));
        }
        return sb.toString();
    }

    private String messagesText(ConversationThread thread, List<MessageRecord> messages) {
        String peer = firstNonBlank(thread.getContactName(), thread.getGroupName(), thread.getPhone(), thread.getId());
        StringBuilder sb = new StringBuilder();
        sb.append("Conversation with ").append(peer).append('\n').append('\n');
        for (MessageRecord m : messages) {
            String who = m.getDirection() == MessageDirection.OUTBOUND ? "Me" : firstNonBlank(m.getPhone(), peer);
            sb.append('[').append(time(m.getTimestamp())).append("] ")
                    .append(who).append(": ")
                    .append(m.getText() == null ? "" : m.getText());
            if (!m.getAttachments().isEmpty()) {
                sb.append(" (attachments: ").append(String.join(", ", m.getAttachments())).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    // ===== calls =====

    private String callsCsv(List<CallRecord> calls) {
        StringBuilder sb = new StringBuilder("Time,Contact,Phone,Direction,Type,Duration\n");
        for (CallRecord c : calls) {
            sb.append(csvRow(
                    time(c.getTimestamp()),
                    firstNonBlank(c.getContactName(), "Unknown"),
                    c.getPhone(),
                    c.getDirection().name().toLowerCase(),
                    c.getKind().name().toLowerCase(),
                    formatDuration(c.getDurationSeconds())));
        }
        return sb.toString();
    }

    private String callsText(List<CallRecord> calls) {
        StringBuilder sb = new StringBuilder();
        for (CallRecord c : calls) {
            String who = firstNonBlank(c.getContactName(), c.getPhone());
            sb.append(time(c.getTimestamp())).append(" - ")
                    .append(c.getDirection().name())
                    .append(c.getDirection() == CallDirection.OUTGOING ? " call to " : " call from ")
                    .append(who)
                    .append(" (").append(formatDuration(c.getDurationSeconds())).append(")\n");
        }
        return sb.toString();
    }

    // ===== helpers =====

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize export", e);
        }
    }

    static String csvRow(String... cells) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(csvCell(cells[i]));
        }
        return sb.append('\n').toString();
    }

    /** 含逗号、引号、换行的单元格加双引号，内部引号双写 */
    static String csvCell(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }

    /** 90 → 1:30，3725 → 1:02:05 */
    static String formatDuration(long seconds) {
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        return h > 0 ? String.format("%d:%02d:%02d", h, m, s) : String.format("%d:%02d", m, s);
    }

    private static String time(Instant instant) {
        return instant == null ? "" : TIME_FORMAT.format(instant);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return "";
    }
}
