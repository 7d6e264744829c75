package net.cronhook.integration.spring.sched;

import net.cronhook.core.maintenance.QueueMaintenanceService;
import net.cronhook.core.maintenance.QueueMaintenanceService.MaintenanceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/** 클러스터 모드 주기 작업 */
public class CronhookSchedulers {
    private static final Logger log = LoggerFactory.getLogger(CronhookSchedulers.class);

    private final QueueMaintenanceService maintenance;

    public CronhookSchedulers(QueueMaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${cronhook.cluster.maintenance-delay-ms:30000}")
    public void maintenance() throws Exception {
        MaintenanceReport r = maintenance.runOnce();
        if (r.failedStalled > 0) {
            log.warn("Marked {} stalled runs as failed", r.failedStalled);
        }
    }
}
