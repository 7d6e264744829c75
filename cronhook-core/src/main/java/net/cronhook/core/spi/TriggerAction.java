package net.cronhook.core.spi;

import net.cronhook.core.model.HttpMethod;

/**
 * 잡 발화 시 부수효과(HTTP 호출).
 * 구현체는 자체 타임아웃을 두고, 어떤 경우에도 예외를 던지지 않는다.
 */
@FunctionalInterface
public interface TriggerAction {
    void notify(String uri, HttpMethod method, String body);
}
