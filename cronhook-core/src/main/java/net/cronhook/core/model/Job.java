package net.cronhook.core.model;

import java.time.Instant;

public record Job(
        String id,
        String uri,
        HttpMethod httpMethod,
        String body,          // GET이면 무시
        String schedule,      // 5필드 cron
        String timeZone,      // IANA 이름, 검증 후 저장
        boolean active,
        Instant createdAt,
        Instant updatedAt,
        Instant lastRun,      // 첫 실행 전 null
        Instant nextRun
) {
}
