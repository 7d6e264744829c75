package net.cronhook.core.model;

/** 반복 엔트리 등록 옵션. keep* = 완료/실패 런 보관 개수 */
public record RepeatOptions(
        String pattern,
        String timeZone,
        int keepCompleted,
        int keepFailed
) {
}
