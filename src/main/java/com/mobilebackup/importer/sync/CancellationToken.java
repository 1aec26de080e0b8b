package com.mobilebackup.importer.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消：提取和入库都在两条记录之间检查一次。
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
