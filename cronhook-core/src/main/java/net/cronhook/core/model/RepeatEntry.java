package net.cronhook.core.model;

import java.time.Instant;

public record RepeatEntry(
        String queueName,
        String entryId,       // = job id
        String name,          // "cron-<id>"
        String pattern,
        String timeZone,
        Instant nextDueAt,
        int keepCompleted,
        int keepFailed,
        Instant createdAt,
        Instant updatedAt
) {
}
