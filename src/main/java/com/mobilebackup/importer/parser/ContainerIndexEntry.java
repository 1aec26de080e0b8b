package com.mobilebackup.importer.parser;

import lombok.Data;

/** Files 表里的一行：fileID + domain + relativePath */
@Data
public class ContainerIndexEntry {
    private String fileId;
    private String domain;
    private String relativePath;

    /** domain-relativePath，日志里展示用 */
    public String logicalPath() {
        return domain == null || domain.isEmpty() ? relativePath : domain + "/" + relativePath;
    }
}
