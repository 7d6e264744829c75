package net.cronhook.core.error;

public class InvalidScheduleException extends RuntimeException {
    private final String schedule;

    public InvalidScheduleException(String schedule) {
        super("Invalid CRON expression: " + schedule);
        this.schedule = schedule;
    }

    public String getSchedule() {
        return schedule;
    }
}
