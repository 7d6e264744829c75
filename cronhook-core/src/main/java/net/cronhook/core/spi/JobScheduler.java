package net.cronhook.core.spi;

import net.cronhook.core.model.Job;

/**
 * 잡 id 당 하나의 반복 엔트리를 유지하는 스케줄러.
 * 로컬 타이머 / 공유 큐 두 구현이 있고 기동 시 한 번 선택된다.
 */
public interface JobScheduler {
    /** 발화 핸들러 연결 + 자원 기동. 실패 시 SchedulerInitializationException */
    void start(JobFireHandler handler);

    /** 실패 시 SchedulerRegistrationException */
    void schedule(Job job);

    /** 없는 id면 no-op */
    void unschedule(String jobId);

    int activeLocalTaskCount();

    boolean clustered();

    /** 멱등. 진행 중 실행은 끝까지 둔다 */
    void close();
}
