package net.cronhook.core.cluster;

import net.cronhook.core.model.QueueRun;
import net.cronhook.core.model.RepeatEntry;
import net.cronhook.core.model.RepeatOptions;
import net.cronhook.core.schedule.TimeZones;
import net.cronhook.core.spi.BrokerSchema;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.CronCalculator;
import net.cronhook.core.spi.QueueRunRepository;
import net.cronhook.core.spi.RepeatEntryRepository;
import net.cronhook.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 공유 DB 위의 이름 있는 큐.
 *
 * <p>런 상태 전이: DELAYED -> WAITING -> ACTIVE -> COMPLETED | FAILED.
 * 승격과 클레임은 모두 CAS 업데이트라서 플릿 전체에서 한 프로세스만 이긴다.
 */
public final class SharedQueue {
    private static final Logger log = LoggerFactory.getLogger(SharedQueue.class);

    private final String name;
    private final RepeatEntryRepository entries;
    private final QueueRunRepository runs;
    private final TxRunner tx;
    private final Clock clock;
    private final CronCalculator cron;
    private final BrokerSchema schema;

    public SharedQueue(String name,
                       RepeatEntryRepository entries,
                       QueueRunRepository runs,
                       TxRunner tx,
                       Clock clock,
                       CronCalculator cron,
                       BrokerSchema schema) {
        this.name = name;
        this.entries = entries;
        this.runs = runs;
        this.tx = tx;
        this.clock = clock;
        this.cron = cron;
        this.schema = schema;
    }

    public String name() {
        return name;
    }

    /** 스키마 마이그레이션 후 ping. 브로커에 닿지 못하면 예외 */
    public void open() throws Exception {
        schema.migrate();
        int count = ping();
        log.info("Shared queue {} opened ({} repeat entries)", name, count);
    }

    /** 브로커 도달 + 스키마 존재 확인 */
    public int ping() throws Exception {
        return tx.required(() -> entries.count(name));
    }

    /** 같은 entryId가 이미 있으면 기존 엔트리를 그대로 돌려준다 */
    public RepeatEntry addRepeatable(String entryName, String entryId, RepeatOptions opts) throws Exception {
        return tx.requiresNew(() -> {
            Optional<RepeatEntry> existing = entries.findById(name, entryId);
            if (existing.isPresent()) return existing.get();

            Instant now = clock.now();
            Instant firstDue = cron.next(now, opts.pattern(), TimeZones.resolve(opts.timeZone()));
            RepeatEntry entry = new RepeatEntry(name, entryId, entryName, opts.pattern(), opts.timeZone(),
                    firstDue, opts.keepCompleted(), opts.keepFailed(), now, now);

            if (!entries.insertIfAbsent(entry)) {
                // 동시 등록에서 졌다
                return entries.findById(name, entryId).orElse(entry);
            }
            runs.insert(QueueRun.delayed(entry, firstDue, now));
            return entry;
        });
    }

    public Optional<RepeatEntry> findRepeatable(String entryId) throws Exception {
        return tx.required(() -> entries.findById(name, entryId));
    }

    public List<RepeatEntry> getRepeatables() throws Exception {
        return tx.required(() -> entries.findAll(name));
    }

    public boolean removeRepeatable(RepeatEntry entry) throws Exception {
        return tx.requiresNew(() -> entries.delete(name, entry.entryId()));
    }

    /** 버킷 조회. start/end 모두 포함 */
    public List<QueueRun> getRuns(QueueRun.Status status, int start, int end) throws Exception {
        if (end < start) return List.of();
        return tx.required(() -> runs.findByStatus(name, status, start, end - start + 1));
    }

    public boolean removeRun(long runId) throws Exception {
        return tx.requiresNew(() -> runs.delete(runId));
    }

    /**
     * 기한이 된 DELAYED 런을 WAITING으로 올린다.
     * 승격에 이긴 프로세스만 엔트리 커서를 전진시키고 다음 DELAYED 런을 만든다.
     * 엔트리가 이미 지워졌으면 다음 런은 만들지 않는다.
     */
    public int promoteDue(int limit) throws Exception {
        List<QueueRun> due = tx.required(() -> runs.findDue(name, clock.now(), limit));
        int promoted = 0;
        for (QueueRun run : due) {
            boolean won = tx.requiresNew(() -> {
                Instant now = clock.now();
                if (!runs.promote(run.id(), now)) return false;

                Optional<RepeatEntry> entry = entries.findById(name, run.entryId());
                if (entry.isEmpty()) return true;

                RepeatEntry e = entry.get();
                // 멈춰 있던 동안 지나간 발생분은 재생하지 않는다
                Instant base = run.availableAt().isAfter(now) ? run.availableAt() : now;
                Instant next = cron.next(base, e.pattern(), TimeZones.resolve(e.timeZone()));
                // 조회 후 동시 삭제된 엔트리는 갱신 0건
                if (entries.advance(name, e.entryId(), next, now)) {
                    runs.insert(QueueRun.delayed(e, next, now));
                }
                return true;
            });
            if (won) promoted++;
        }
        return promoted;
    }

    /** WAITING 한 건을 ACTIVE로 가져온다. 경쟁에서 모두 지면 empty */
    public Optional<QueueRun> claimNext(String owner, Duration lease) throws Exception {
        List<QueueRun> waiting = tx.required(() -> runs.findByStatus(name, QueueRun.Status.WAITING, 0, 10));
        for (QueueRun candidate : waiting) {
            Optional<QueueRun> claimed = tx.requiresNew(() -> {
                Instant now = clock.now();
                if (!runs.claim(candidate.id(), owner, now.plus(lease), now)) return Optional.<QueueRun>empty();
                return runs.findById(candidate.id());
            });
            if (claimed.isPresent()) return claimed;
        }
        return Optional.empty();
    }

    public boolean complete(QueueRun run, String owner) throws Exception {
        return finish(run, owner, QueueRun.Status.COMPLETED, null, run.keepCompleted());
    }

    public boolean fail(QueueRun run, String owner, String error) throws Exception {
        return finish(run, owner, QueueRun.Status.FAILED, error, run.keepFailed());
    }

    private boolean finish(QueueRun run, String owner, QueueRun.Status status, String error, int keep) throws Exception {
        return tx.requiresNew(() -> {
            if (!runs.finish(run.id(), owner, status, error, clock.now())) {
                log.warn("Run {} was no longer owned by {} when marking it {}", run.id(), owner, status);
                return false;
            }
            int trimmed = runs.trim(name, run.entryId(), status, keep);
            if (trimmed > 0) log.debug("Trimmed {} {} runs of {}", trimmed, status, run.entryId());
            return true;
        });
    }

    /** lease 만료 ACTIVE -> FAILED. 재전달하지 않는다 */
    public int failStalled(String reason) throws Exception {
        return tx.requiresNew(() -> runs.failExpiredLeases(name, clock.now(), reason));
    }

    /** entryId의 런을 버킷별로 최대 limit 건 훑어 지운다. 버킷별 오류는 로그만 남긴다 */
    public int sweepRuns(String entryId, List<QueueRun.Status> buckets, int limit) {
        List<Long> removed = new ArrayList<>();
        for (QueueRun.Status bucket : buckets) {
            try {
                for (QueueRun run : getRuns(bucket, 0, limit - 1)) {
                    if (entryId.equals(run.jobId()) && removeRun(run.id())) {
                        removed.add(run.id());
                    }
                }
            } catch (Exception e) {
                log.debug("Error sweeping {} runs of {}: {}", bucket, entryId, e.toString());
            }
        }
        return removed.size();
    }
}
