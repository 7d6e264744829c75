package net.cronhook.core.spi;

public interface BrokerSchema {
    /** 공유 큐 스키마를 최신으로 맞춘다. 브로커에 닿지 못하면 예외 */
    void migrate() throws Exception;
}
