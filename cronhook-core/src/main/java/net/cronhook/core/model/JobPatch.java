package net.cronhook.core.model;

import java.time.Instant;

/** 저장소 단의 부분 갱신. null = 유지 */
public record JobPatch(
        String uri,
        HttpMethod httpMethod,
        String body,
        String schedule,
        String timeZone,
        Boolean active,
        Instant lastRun,
        Instant nextRun
) {
    public static JobPatch empty() {
        return new JobPatch(null, null, null, null, null, null, null, null);
    }

    public static JobPatch from(JobUpdate u) {
        return new JobPatch(u.uri(), u.httpMethod(), u.body(), u.schedule(), u.timeZone(), u.active(), null, null);
    }

    public JobPatch withTimeZone(String timeZone) {
        return new JobPatch(uri, httpMethod, body, schedule, timeZone, active, lastRun, nextRun);
    }

    public JobPatch withLastRun(Instant lastRun) {
        return new JobPatch(uri, httpMethod, body, schedule, timeZone, active, lastRun, nextRun);
    }

    public JobPatch withNextRun(Instant nextRun) {
        return new JobPatch(uri, httpMethod, body, schedule, timeZone, active, lastRun, nextRun);
    }

    /** 병합 결과. updatedAt은 저장소가 찍는다 */
    public Job applyTo(Job job, Instant updatedAt) {
        return new Job(
                job.id(),
                uri != null ? uri : job.uri(),
                httpMethod != null ? httpMethod : job.httpMethod(),
                body != null ? body : job.body(),
                schedule != null ? schedule : job.schedule(),
                timeZone != null ? timeZone : job.timeZone(),
                active != null ? active : job.active(),
                job.createdAt(),
                updatedAt,
                lastRun != null ? lastRun : job.lastRun(),
                nextRun != null ? nextRun : job.nextRun()
        );
    }
}
