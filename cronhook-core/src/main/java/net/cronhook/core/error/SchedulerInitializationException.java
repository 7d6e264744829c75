package net.cronhook.core.error;

public class SchedulerInitializationException extends RuntimeException {
    public SchedulerInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
