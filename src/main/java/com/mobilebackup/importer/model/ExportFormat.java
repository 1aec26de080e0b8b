package com.mobilebackup.importer.model;

import java.util.Locale;

public enum ExportFormat {
    CSV("text/csv", "csv"),
    JSON("application/json", "json"),
    TXT("text/plain", "txt");

    private final String contentType;
    private final String extension;

    ExportFormat(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    public String contentType() {
        return contentType;
    }

    public String extension() {
        return extension;
    }

    /** 缺省 csv */
    public static ExportFormat fromKey(String value) {
        if (value == null || value.isBlank()) {
            return CSV;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported export format: " + value, e);
        }
    }
}
