package net.cronhook.core.local;

import net.cronhook.core.error.SchedulerRegistrationException;
import net.cronhook.core.model.Job;
import net.cronhook.core.schedule.TimeZones;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.CronCalculator;
import net.cronhook.core.spi.JobFireHandler;
import net.cronhook.core.spi.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** 단일 인스턴스 모드: 잡 id -> 타이머 작업 인메모리 인덱스 */
public final class LocalJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(LocalJobScheduler.class);

    private final CronCalculator cron;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor timer;
    private final Map<String, RepeatingTask> tasks = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile JobFireHandler handler;

    public LocalJobScheduler(CronCalculator cron, Clock clock, int poolSize) {
        this.cron = cron;
        this.clock = clock;
        AtomicInteger seq = new AtomicInteger();
        this.timer = new ScheduledThreadPoolExecutor(Math.max(1, poolSize), r -> {
            Thread t = new Thread(r, "cronhook-local-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timer.setRemoveOnCancelPolicy(true);
        this.timer.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void start(JobFireHandler handler) {
        this.handler = handler;
        log.info("Local scheduler started (pool size {})", timer.getCorePoolSize());
    }

    @Override
    public void schedule(Job job) {
        JobFireHandler h = handler;
        if (h == null || closed.get()) {
            throw new SchedulerRegistrationException("Local scheduler is not running; cannot schedule job " + job.id());
        }
        String id = job.id();
        ZoneId zone = TimeZones.resolve(job.timeZone());
        RepeatingTask task = new RepeatingTask(
                "job-" + id,
                () -> h.fire(id),
                from -> cron.next(from, job.schedule(), zone),
                timer,
                clock);
        try {
            task.start();
        } catch (RuntimeException e) {
            log.error("Failed to schedule job {} locally", id, e);
            throw new SchedulerRegistrationException("Failed to schedule job " + id, e);
        }

        RepeatingTask previous = tasks.put(id, task);
        if (previous != null) previous.stop();
        log.info("Scheduled job {} locally with [{}] ({}), first fire at {}", id, job.schedule(), zone, task.nextPlanned());
    }

    @Override
    public void unschedule(String jobId) {
        RepeatingTask task = tasks.remove(jobId);
        if (task != null) {
            task.stop();
            log.info("Unscheduled local job {}", jobId);
        }
    }

    /** 다음 발화 예정 시각 (진단용) */
    public Optional<Instant> nextFireOf(String jobId) {
        RepeatingTask task = tasks.get(jobId);
        return task == null ? Optional.empty() : Optional.ofNullable(task.nextPlanned());
    }

    @Override
    public int activeLocalTaskCount() {
        return tasks.size();
    }

    @Override
    public boolean clustered() {
        return false;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        tasks.forEach((id, task) -> {
            task.stop();
            log.info("Stopped task {}", id);
        });
        tasks.clear();
        timer.shutdown(); // 실행 중인 발화는 끝까지
    }
}
