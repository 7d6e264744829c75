package net.cronhook.core.cluster;

import java.time.Duration;

/**
 * @param concurrency 동시에 처리하는 런 수
 * @param pollDelay   폴링 간격 (fixed delay)
 * @param lease       클레임 lease. 지나면 유지보수가 FAILED 처리
 * @param batchSize   폴링당 승격 최대 건수
 * @param drainTimeout close 시 진행 중 런 대기 한도
 */
public record WorkerOptions(
        int concurrency,
        Duration pollDelay,
        Duration lease,
        int batchSize,
        Duration drainTimeout
) {
    public static WorkerOptions defaults() {
        return new WorkerOptions(4, Duration.ofSeconds(1), Duration.ofMinutes(5), 20, Duration.ofSeconds(30));
    }

    public WorkerOptions {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
    }
}
