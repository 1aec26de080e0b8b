package com.mobilebackup.importer.exception;

import com.mobilebackup.importer.model.RecordCategory;

import java.time.Duration;

public class CooldownActiveException extends SyncRejectedException {

    private final Duration remaining;

    public CooldownActiveException(RecordCategory category, Duration remaining) {
        super("COOLDOWN_ACTIVE", category,
                String.format("Sync for %s is cooling down (%ds remaining)",
                        category.key(), (long) Math.ceil(remaining.toMillis() / 1000.0)));
        this.remaining = remaining;
    }

    public Duration getRemaining() {
        return remaining;
    }
}
