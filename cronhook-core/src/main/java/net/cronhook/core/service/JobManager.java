package net.cronhook.core.service;

import net.cronhook.core.error.InvalidScheduleException;
import net.cronhook.core.error.JobNotFoundException;
import net.cronhook.core.model.Job;
import net.cronhook.core.model.JobDraft;
import net.cronhook.core.model.JobPatch;
import net.cronhook.core.model.JobUpdate;
import net.cronhook.core.model.ServiceStatus;
import net.cronhook.core.schedule.NextRunCalculator;
import net.cronhook.core.schedule.TimeZones;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.CronCalculator;
import net.cronhook.core.spi.JobScheduler;
import net.cronhook.core.spi.JobStore;
import net.cronhook.core.spi.TriggerAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 잡 CRUD + 스케줄러 위임 + 실행 경로.
 *
 * <p>스케줄러는 기동 시 한 번 정해지며 여기서는 {@link JobScheduler} 인터페이스만 본다.
 * 스케줄러가 발화하면 {@link #executeJob(String)} 으로 돌아온다.
 */
public final class JobManager {
    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    private final JobStore store;
    private final JobScheduler scheduler;
    private final TriggerAction trigger;
    private final CronCalculator cron;
    private final NextRunCalculator nextRuns;
    private final Clock clock;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final Set<String> executing = ConcurrentHashMap.newKeySet();

    public JobManager(JobStore store,
                      JobScheduler scheduler,
                      TriggerAction trigger,
                      CronCalculator cron,
                      NextRunCalculator nextRuns,
                      Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.trigger = trigger;
        this.cron = cron;
        this.nextRuns = nextRuns;
        this.clock = clock;
    }

    /** 스케줄러 기동. 동시 호출 중 하나만 진행. 실패하면 미초기화 상태로 남고 예외를 그대로 던진다 */
    public void start() {
        if (!initialized.compareAndSet(false, true)) return;
        String mode = scheduler.clustered() ? "cluster" : "local";
        try {
            scheduler.start(this::executeJob);
        } catch (RuntimeException e) {
            initialized.set(false);
            log.error("Failed to initialize {} scheduler", mode, e);
            throw e;
        }
        log.info("Job manager initialized in {} mode", mode);
    }

    /** 멱등. start 전에 불려도 안전 */
    public void shutdown() {
        boolean wasInitialized = initialized.getAndSet(false);
        scheduler.close();
        if (wasInitialized) log.info("Job manager shut down");
    }

    public Job createJob(JobDraft draft) {
        return register(UUID.randomUUID().toString(), draft);
    }

    /**
     * 카탈로그 시드용. 정해진 id로 만들고, 이미 있으면 기존 잡을 돌려준다.
     * 플릿의 모든 인스턴스가 같은 id를 쓰면 브로커 엔트리도 하나로 모인다.
     */
    public Job seedJob(String id, JobDraft draft) {
        Optional<Job> existing = store.findById(id);
        if (existing.isPresent()) return existing.get();
        return register(id, draft);
    }

    private Job register(String id, JobDraft draft) {
        if (draft.uri() == null || draft.uri().isBlank()) {
            throw new IllegalArgumentException("uri must not be blank");
        }
        if (draft.httpMethod() == null) {
            throw new IllegalArgumentException("httpMethod is required");
        }
        validateSchedule(draft.schedule());

        String timeZone = TimeZones.normalize(draft.timeZone());
        Instant now = clock.now();
        Job job = new Job(
                id,
                draft.uri(),
                draft.httpMethod(),
                draft.body(),
                draft.schedule(),
                timeZone,
                true,
                now,
                now,
                null,
                nextRuns.computeNextRun(draft.schedule(), timeZone, now).orElse(null));

        store.create(job);
        scheduler.schedule(job);
        log.info("Created CRON job {} with schedule: {}", job.id(), job.schedule());
        return job;
    }

    /**
     * 항상 먼저 등록 해제하고, 결과 잡이 활성일 때만 다시 등록한다.
     * 스케줄이 올 때만 nextRun을 다시 계산한다 (타임존만 바뀌면 기존 값 유지).
     */
    public Optional<Job> updateJob(JobUpdate update) {
        Job existing = store.findById(update.id())
                .orElseThrow(() -> new JobNotFoundException(update.id()));
        if (update.schedule() != null) validateSchedule(update.schedule());

        JobPatch patch = JobPatch.from(update);
        if (update.timeZone() != null) {
            patch = patch.withTimeZone(TimeZones.normalize(update.timeZone()));
        }

        scheduler.unschedule(existing.id());

        if (update.schedule() != null) {
            String schedule = update.schedule();
            String timeZone = patch.timeZone() != null ? patch.timeZone() : existing.timeZone();
            Optional<Instant> next = nextRuns.computeNextRun(schedule, timeZone, clock.now());
            if (next.isPresent()) patch = patch.withNextRun(next.get());
        }

        Optional<Job> updated = store.update(existing.id(), patch);
        if (updated.isEmpty()) {
            log.warn("CRON job {} disappeared during update", existing.id());
            return Optional.empty();
        }

        Job job = updated.get();
        if (job.active()) {
            scheduler.schedule(job);
        }
        log.info("Updated CRON job {}", job.id());
        return updated;
    }

    public boolean deleteJob(String id) {
        if (store.findById(id).isEmpty()) return false;
        scheduler.unschedule(id);
        boolean deleted = store.delete(id);
        if (deleted) log.info("Deleted CRON job {}", id);
        return deleted;
    }

    public Optional<Job> getJob(String id) {
        return store.findById(id);
    }

    public List<Job> listJobs() {
        return store.findAll();
    }

    public ServiceStatus getStatus() {
        return new ServiceStatus(
                initialized.get(),
                scheduler.clustered(),
                scheduler.activeLocalTaskCount(),
                store.count());
    }

    /** 스케줄러 발화 경로. 예외를 밖으로 내보내지 않는다 */
    public void executeJob(String id) {
        if (!executing.add(id)) {
            log.warn("CRON job {} is still running, skipping overlapping fire", id);
            return;
        }
        try {
            Optional<Job> found = store.findById(id);
            if (found.isEmpty()) {
                log.debug("CRON job {} not found, skipping", id);
                return;
            }
            Job job = found.get();
            if (!job.active()) {
                log.debug("CRON job {} is inactive, skipping", id);
                return;
            }

            log.info("Executing CRON job {}: {} {}", id, job.httpMethod(), job.uri());
            trigger.notify(job.uri(), job.httpMethod(), job.body());

            Instant now = clock.now();
            JobPatch patch = JobPatch.empty().withLastRun(now);
            Optional<Instant> next = nextRuns.computeNextRun(job.schedule(), job.timeZone(), now);
            if (next.isPresent()) patch = patch.withNextRun(next.get());
            store.update(id, patch);
            log.info("CRON job {} executed, next run at {}", id, next.orElse(null));
        } catch (RuntimeException e) {
            log.error("Error executing CRON job {}", id, e);
        } finally {
            executing.remove(id);
        }
    }

    private void validateSchedule(String schedule) {
        if (schedule == null || schedule.trim().split("\\s+").length != 5 || !cron.isValid(schedule)) {
            throw new InvalidScheduleException(schedule);
        }
    }
}
