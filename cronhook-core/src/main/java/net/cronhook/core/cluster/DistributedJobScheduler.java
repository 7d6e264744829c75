package net.cronhook.core.cluster;

import net.cronhook.core.error.SchedulerInitializationException;
import net.cronhook.core.error.SchedulerRegistrationException;
import net.cronhook.core.model.Job;
import net.cronhook.core.model.QueueRun;
import net.cronhook.core.model.RepeatEntry;
import net.cronhook.core.model.RepeatOptions;
import net.cronhook.core.schedule.TimeZones;
import net.cronhook.core.spi.JobFireHandler;
import net.cronhook.core.spi.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/** 클러스터 모드: 잡 하나 = 공유 큐 반복 엔트리 하나 */
public final class DistributedJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(DistributedJobScheduler.class);

    public static final String NAME_PREFIX = "cron-";
    static final int SWEEP_LIMIT = 100;
    private static final List<QueueRun.Status> SWEEP_BUCKETS = List.of(
            QueueRun.Status.WAITING,
            QueueRun.Status.DELAYED,
            QueueRun.Status.ACTIVE,
            QueueRun.Status.COMPLETED,
            QueueRun.Status.FAILED);

    private final SharedQueue queue;
    private final WorkerOptions workerOptions;
    private final String workerId;
    private final int keepCompleted;
    private final int keepFailed;

    private volatile QueueWorker worker;

    public DistributedJobScheduler(SharedQueue queue,
                                   WorkerOptions workerOptions,
                                   String workerId,
                                   int keepCompleted,
                                   int keepFailed) {
        this.queue = queue;
        this.workerOptions = workerOptions;
        this.workerId = workerId;
        this.keepCompleted = keepCompleted;
        this.keepFailed = keepFailed;
    }

    public static String entryName(String jobId) {
        return NAME_PREFIX + jobId;
    }

    @Override
    public synchronized void start(JobFireHandler handler) {
        if (worker != null) return;
        try {
            queue.open();
        } catch (Exception e) {
            log.error("Failed to connect to broker for queue {}", queue.name(), e);
            throw new SchedulerInitializationException("Broker unreachable for queue " + queue.name(), e);
        }
        QueueWorker w = new QueueWorker(queue, run -> handler.fire(run.jobId()), workerOptions, workerId);
        w.start();
        worker = w;
        log.info("Distributed scheduler started on queue {}", queue.name());
    }

    @Override
    public void schedule(Job job) {
        RepeatOptions opts = new RepeatOptions(job.schedule(), TimeZones.normalize(job.timeZone()), keepCompleted, keepFailed);
        try {
            RepeatEntry entry = queue.addRepeatable(entryName(job.id()), job.id(), opts);
            log.info("Scheduled job {} in queue {} with [{}], next due {}", job.id(), queue.name(), job.schedule(), entry.nextDueAt());
        } catch (Exception e) {
            log.error("Failed to schedule job {} in queue {}", job.id(), queue.name(), e);
            throw new SchedulerRegistrationException("Failed to schedule job " + job.id() + " in shared queue", e);
        }
    }

    @Override
    public void unschedule(String jobId) {
        try {
            Optional<RepeatEntry> entry = queue.findRepeatable(jobId);
            if (entry.isEmpty()) {
                String name = entryName(jobId);
                entry = queue.getRepeatables().stream().filter(e -> name.equals(e.name())).findFirst();
            }
            if (entry.isPresent()) {
                queue.removeRepeatable(entry.get());
                log.info("Removed repeat entry {} for job {}", entry.get().name(), jobId);
            }
            int swept = queue.sweepRuns(jobId, SWEEP_BUCKETS, SWEEP_LIMIT);
            if (swept > 0) log.info("Removed {} queued runs for job {}", swept, jobId);
        } catch (Exception e) {
            log.error("Failed to unschedule job {} from queue {}", jobId, queue.name(), e);
        }
    }

    @Override
    public int activeLocalTaskCount() {
        return 0;
    }

    @Override
    public boolean clustered() {
        return true;
    }

    @Override
    public synchronized void close() {
        QueueWorker w = worker;
        worker = null;
        if (w != null) w.close();
    }
}
