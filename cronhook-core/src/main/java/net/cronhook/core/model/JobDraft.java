package net.cronhook.core.model;

/** 잡 생성 입력 */
public record JobDraft(
        String uri,
        HttpMethod httpMethod,
        String body,
        String schedule,
        String timeZone
) {
}
