package net.cronhook.core.spi;

@FunctionalInterface
public interface JobFireHandler {
    void fire(String jobId);
}
