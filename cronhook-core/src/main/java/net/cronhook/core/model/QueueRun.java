package net.cronhook.core.model;

import java.time.Instant;
import java.util.Locale;

public record QueueRun(
        Long id,
        String queueName,
        String name,
        String entryId,
        String jobId,         // payload
        Status status,
        Instant availableAt,
        String leaseOwner,
        Instant leaseUntil,
        int keepCompleted,
        int keepFailed,
        Instant createdAt,
        Instant updatedAt,
        Instant finishedAt,
        String lastError
) {
    public enum Status {
        DELAYED, WAITING, ACTIVE, COMPLETED, FAILED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    /** 엔트리의 다음 발생분을 DELAYED 런으로 만든다 */
    public static QueueRun delayed(RepeatEntry entry, Instant availableAt, Instant now) {
        return new QueueRun(null, entry.queueName(), entry.name(), entry.entryId(), entry.entryId(),
                Status.DELAYED, availableAt, null, null,
                entry.keepCompleted(), entry.keepFailed(), now, now, null, null);
    }
}
