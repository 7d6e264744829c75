package net.cronhook.core.model;

/**
 * 잡 수정 입력. null 필드는 변경하지 않는다.
 * lastRun/nextRun은 클라이언트가 건드릴 수 없으므로 여기 없다.
 */
public record JobUpdate(
        String id,
        String uri,
        HttpMethod httpMethod,
        String body,
        String schedule,
        String timeZone,
        Boolean active
) {
    public static JobUpdate of(String id) {
        return new JobUpdate(id, null, null, null, null, null, null);
    }

    public JobUpdate withUri(String uri) {
        return new JobUpdate(id, uri, httpMethod, body, schedule, timeZone, active);
    }

    public JobUpdate withHttpMethod(HttpMethod httpMethod) {
        return new JobUpdate(id, uri, httpMethod, body, schedule, timeZone, active);
    }

    public JobUpdate withBody(String body) {
        return new JobUpdate(id, uri, httpMethod, body, schedule, timeZone, active);
    }

    public JobUpdate withSchedule(String schedule) {
        return new JobUpdate(id, uri, httpMethod, body, schedule, timeZone, active);
    }

    public JobUpdate withTimeZone(String timeZone) {
        return new JobUpdate(id, uri, httpMethod, body, schedule, timeZone, active);
    }

    public JobUpdate withActive(boolean active) {
        return new JobUpdate(id, uri, httpMethod, body, schedule, timeZone, active);
    }
}
