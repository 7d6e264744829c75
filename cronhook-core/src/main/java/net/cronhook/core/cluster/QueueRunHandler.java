package net.cronhook.core.cluster;

import net.cronhook.core.model.QueueRun;

@FunctionalInterface
public interface QueueRunHandler {
    /** 예외를 던지면 런은 FAILED */
    void handle(QueueRun run) throws Exception;
}
