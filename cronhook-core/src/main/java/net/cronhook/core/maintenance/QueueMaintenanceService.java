package net.cronhook.core.maintenance;

import net.cronhook.core.cluster.SharedQueue;
import net.cronhook.core.spi.Clock;

import java.time.Instant;

public final class QueueMaintenanceService {
    public static final String DEFAULT_EXPIRED_REASON = "lease expired, marked failed by maintenance";

    private final SharedQueue queue;
    private final Clock clock;

    public QueueMaintenanceService(SharedQueue queue, Clock clock) {
        this.queue = queue;
        this.clock = clock;
    }

    /**
     * 주기 점검.
     * - lease 만료된 ACTIVE 런을 FAILED로 (재전달 없음)
     */
    public MaintenanceReport runOnce() throws Exception {
        MaintenanceReport r = new MaintenanceReport();
        r.timestamp = clock.now();
        r.failedStalled = queue.failStalled(DEFAULT_EXPIRED_REASON);
        return r;
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public int failedStalled;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", failedStalled=" + failedStalled +
                    '}';
        }
    }
}
