package net.cronhook.core.error;

/** 타이머/브로커 등록 실패. 잡은 저장된 채 미스케줄 상태로 남는다 */
public class SchedulerRegistrationException extends RuntimeException {
    public SchedulerRegistrationException(String message) {
        super(message);
    }

    public SchedulerRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
