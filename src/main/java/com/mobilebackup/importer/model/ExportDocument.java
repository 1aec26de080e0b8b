package com.mobilebackup.importer.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ExportDocument {
    private String fileName;
    private ExportFormat format;
    private String content;
    private int recordCount;
}
