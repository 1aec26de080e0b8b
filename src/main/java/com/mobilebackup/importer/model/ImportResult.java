package com.mobilebackup.importer.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 单个类别一次导入的结果：imported / updated / skipped / errors，
 * 外加人类可读的错误与警告列表。部分成功不会被报告成整体失败。
 */
@Data
public class ImportResult {
    private RecordCategory category;
    private int imported;
    private int updated;
    private int skipped;
    private int errors;
    private List<String> errorMessages = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private boolean sourcePresent = true;
    private boolean cancelled;
    private Set<String> touchedThreadIds = new LinkedHashSet<>();

    public static ImportResult of(RecordCategory category) {
        ImportResult r = new ImportResult();
        r.setCategory(category);
        return r;
    }

    public void addError(String message) {
        errors++;
        errorMessages.add(message);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public int total() {
        return imported + updated + skipped + errors;
    }
}
