package net.cronhook.adapter.jdbc;

import net.cronhook.adapter.jdbc.repo.JdbcQueueRunRepository;
import net.cronhook.adapter.jdbc.repo.JdbcRepeatEntryRepository;
import net.cronhook.core.cluster.SharedQueue;
import net.cronhook.core.maintenance.QueueMaintenanceService;
import net.cronhook.core.model.QueueRun;
import net.cronhook.core.model.RepeatEntry;
import net.cronhook.core.model.RepeatOptions;
import net.cronhook.core.spi.CronCalculator;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 공유 큐 인수 테스트
 * - 반복 엔트리 멱등 등록
 * - 승격/클레임 CAS 경합에서 한 쪽만 이김
 * - 보관 개수 trim, lease 만료 처리, 제거 + sweep
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class SharedQueueAcceptanceTest extends TestSupport {

    static final String QUEUE = "cron-jobs-test";
    static final List<QueueRun.Status> ALL_BUCKETS = List.of(
            QueueRun.Status.WAITING, QueueRun.Status.DELAYED, QueueRun.Status.ACTIVE,
            QueueRun.Status.COMPLETED, QueueRun.Status.FAILED);

    /** 매 분 0초 */
    static final CronCalculator EVERY_MINUTE = (from, expr, zone) ->
            from.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);

    final AtomicReference<Instant> now = new AtomicReference<>();
    SharedQueue queue;

    @BeforeAll
    void initAll() throws Exception {
        queue = new SharedQueue(QUEUE,
                new JdbcRepeatEntryRepository(),
                new JdbcQueueRunRepository(),
                new JdbcTxRunner(ds),
                now::get,
                EVERY_MINUTE,
                new FlywayBrokerSchema(ds));
        queue.open();
    }

    @BeforeEach
    void reset() throws Exception {
        truncateAll();
        now.set(Instant.parse("2024-01-01T10:00:30Z"));
    }

    static RepeatOptions opts(int keepCompleted, int keepFailed) {
        return new RepeatOptions("* * * * *", "UTC", keepCompleted, keepFailed);
    }

    void tick(Duration d) {
        now.set(now.get().plus(d));
    }

    // ========== t1: 같은 id 두 번 등록 -> 엔트리 1, DELAYED 런 1 ==========
    @Test
    void t1_add_twice_yields_one_entry_and_one_delayed_run() throws Exception {
        RepeatEntry first = queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        RepeatEntry second = queue.addRepeatable("cron-job1", "job1", opts(3, 3));

        assertEquals(first.entryId(), second.entryId());
        assertEquals(10, second.keepCompleted());
        assertEquals(Instant.parse("2024-01-01T10:01:00Z"), first.nextDueAt());

        assertThat(queue.getRepeatables()).extracting(RepeatEntry::name).containsExactly("cron-job1");
        List<QueueRun> delayed = queue.getRuns(QueueRun.Status.DELAYED, 0, 99);
        assertEquals(1, delayed.size());
        assertEquals("job1", delayed.get(0).jobId());
        assertEquals(Instant.parse("2024-01-01T10:01:00Z"), delayed.get(0).availableAt());
    }

    // ========== t2: 승격 -> WAITING + 다음 DELAYED ==========
    @Test
    void t2_promote_due_moves_to_waiting_and_materializes_next() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        assertEquals(0, queue.promoteDue(20), "not due yet");

        now.set(Instant.parse("2024-01-01T10:01:05Z"));
        assertEquals(1, queue.promoteDue(20));
        assertEquals(0, queue.promoteDue(20));

        List<QueueRun> waiting = queue.getRuns(QueueRun.Status.WAITING, 0, 99);
        List<QueueRun> delayed = queue.getRuns(QueueRun.Status.DELAYED, 0, 99);
        assertEquals(1, waiting.size());
        assertEquals(1, delayed.size());
        assertEquals(Instant.parse("2024-01-01T10:02:00Z"), delayed.get(0).availableAt());
        assertEquals(Instant.parse("2024-01-01T10:02:00Z"), queue.findRepeatable("job1").orElseThrow().nextDueAt());
    }

    // ========== t3: 다운타임 동안 지나간 발생분은 재생하지 않음 ==========
    @Test
    void t3_missed_occurrences_are_not_replayed() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(10, 10));

        now.set(Instant.parse("2024-01-01T10:30:10Z"));
        assertEquals(1, queue.promoteDue(20));

        List<QueueRun> delayed = queue.getRuns(QueueRun.Status.DELAYED, 0, 99);
        assertEquals(1, delayed.size());
        assertEquals(Instant.parse("2024-01-01T10:31:00Z"), delayed.get(0).availableAt());
    }

    // ========== t4: 승격 경합: 한 스레드만 이김 ==========
    @Test
    void t4_concurrent_promote_only_one_wins() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        tick(Duration.ofMinutes(1));

        List<Integer> results = race(6, () -> queue.promoteDue(20), 0);

        assertEquals(1, results.stream().mapToInt(Integer::intValue).sum());
        assertEquals(1, queue.getRuns(QueueRun.Status.WAITING, 0, 99).size());
        assertEquals(1, queue.getRuns(QueueRun.Status.DELAYED, 0, 99).size());
    }

    // ========== t5: 클레임 경합: 한 워커만 받음 ==========
    @Test
    void t5_concurrent_claim_only_one_worker_receives_run() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        tick(Duration.ofMinutes(1));
        queue.promoteDue(20);

        List<Optional<QueueRun>> results = race(6,
                () -> queue.claimNext("worker-" + Thread.currentThread().getId(), Duration.ofMinutes(1)),
                Optional.empty());

        List<QueueRun> claimed = results.stream().flatMap(Optional::stream).toList();
        assertEquals(1, claimed.size());
        QueueRun run = claimed.get(0);
        assertEquals(QueueRun.Status.ACTIVE, run.status());
        assertNotNull(run.leaseOwner());
        assertEquals(now.get().plus(Duration.ofMinutes(1)), run.leaseUntil());
        assertTrue(queue.getRuns(QueueRun.Status.WAITING, 0, 99).isEmpty());
    }

    // ========== t6: 완료 런은 보관 개수만 남김 ==========
    @Test
    void t6_completed_runs_are_trimmed_to_retention() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(2, 10));

        List<Long> completed = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            tick(Duration.ofMinutes(1));
            queue.promoteDue(20);
            QueueRun run = queue.claimNext("w1", Duration.ofMinutes(1)).orElseThrow();
            assertTrue(queue.complete(run, "w1"));
            completed.add(run.id());
        }

        assertThat(queue.getRuns(QueueRun.Status.COMPLETED, 0, 99))
                .extracting(QueueRun::id)
                .containsExactlyElementsOf(completed.subList(3, 5));
    }

    // ========== t7: 실패 런은 에러와 함께 보관, 보관 개수 trim ==========
    @Test
    void t7_failed_runs_keep_error_and_are_trimmed() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(10, 1));

        for (int i = 0; i < 2; i++) {
            tick(Duration.ofMinutes(1));
            queue.promoteDue(20);
            QueueRun run = queue.claimNext("w1", Duration.ofMinutes(1)).orElseThrow();
            assertTrue(queue.fail(run, "w1", "boom " + i));
        }

        List<QueueRun> failed = queue.getRuns(QueueRun.Status.FAILED, 0, 99);
        assertEquals(1, failed.size());
        assertEquals("boom 1", failed.get(0).lastError());
        assertNotNull(failed.get(0).finishedAt());
    }

    // ========== t8: 다른 워커 소유 런은 종료 처리 불가 ==========
    @Test
    void t8_finish_requires_owner() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        tick(Duration.ofMinutes(1));
        queue.promoteDue(20);
        QueueRun run = queue.claimNext("w1", Duration.ofMinutes(1)).orElseThrow();

        assertFalse(queue.complete(run, "w2"));
        assertEquals(1, queue.getRuns(QueueRun.Status.ACTIVE, 0, 99).size());
    }

    // ========== t9: lease 만료 ACTIVE -> FAILED ==========
    @Test
    void t9_stalled_runs_fail_after_lease() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        tick(Duration.ofMinutes(1));
        queue.promoteDue(20);
        queue.claimNext("w1", Duration.ofMinutes(1)).orElseThrow();

        assertEquals(0, queue.failStalled("lease expired"));
        tick(Duration.ofMinutes(2));
        assertEquals(1, queue.failStalled("lease expired"));

        List<QueueRun> failed = queue.getRuns(QueueRun.Status.FAILED, 0, 99);
        assertEquals(1, failed.size());
        assertEquals("lease expired", failed.get(0).lastError());
    }

    // ========== t9b: 유지보수 서비스가 lease 만료 런을 정리 ==========
    @Test
    void t9b_maintenance_reports_stalled_runs() throws Exception {
        QueueMaintenanceService maintenance = new QueueMaintenanceService(queue, now::get);
        queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        tick(Duration.ofMinutes(1));
        queue.promoteDue(20);
        queue.claimNext("w1", Duration.ofSeconds(30)).orElseThrow();

        assertEquals(0, maintenance.runOnce().failedStalled);
        tick(Duration.ofMinutes(1));
        QueueMaintenanceService.MaintenanceReport r = maintenance.runOnce();

        assertEquals(1, r.failedStalled);
        assertEquals(now.get(), r.timestamp);
        assertEquals(QueueMaintenanceService.DEFAULT_EXPIRED_REASON,
                queue.getRuns(QueueRun.Status.FAILED, 0, 9).get(0).lastError());
    }

    // ========== t10: 엔트리 제거 후 sweep ==========
    @Test
    void t10_remove_entry_then_sweep_runs() throws Exception {
        queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        queue.addRepeatable("cron-job2", "job2", opts(10, 10));
        tick(Duration.ofMinutes(1));
        queue.promoteDue(20); // job1, job2 각각 WAITING + DELAYED

        RepeatEntry entry = queue.findRepeatable("job1").orElseThrow();
        assertTrue(queue.removeRepeatable(entry));
        assertFalse(queue.removeRepeatable(entry));

        assertEquals(2, queue.sweepRuns("job1", ALL_BUCKETS, 100));
        for (QueueRun.Status s : ALL_BUCKETS) {
            assertThat(queue.getRuns(s, 0, 99)).extracting(QueueRun::jobId).doesNotContain("job1");
        }
        assertThat(queue.getRepeatables()).extracting(RepeatEntry::entryId).containsExactly("job2");
    }

    // ========== t11: 제거된 엔트리는 다음 런을 만들지 않음 ==========
    @Test
    void t11_removed_entry_is_not_rescheduled() throws Exception {
        RepeatEntry entry = queue.addRepeatable("cron-job1", "job1", opts(10, 10));
        queue.removeRepeatable(entry);
        tick(Duration.ofMinutes(1));

        assertEquals(1, queue.promoteDue(20));
        assertTrue(queue.getRuns(QueueRun.Status.DELAYED, 0, 99).isEmpty());
    }

    // ========== t12: getRuns 범위는 end 포함 ==========
    @Test
    void t12_get_runs_range_is_inclusive() throws Exception {
        for (int i = 0; i < 3; i++) queue.addRepeatable("cron-j" + i, "j" + i, opts(10, 10));

        assertEquals(2, queue.getRuns(QueueRun.Status.DELAYED, 0, 1).size());
        assertEquals(1, queue.getRuns(QueueRun.Status.DELAYED, 2, 2).size());
        assertTrue(queue.getRuns(QueueRun.Status.DELAYED, 2, 1).isEmpty());
        assertEquals(3, queue.ping());
    }

    /** threads 개 스레드가 동시에 body 실행. 경합에서 진 쪽의 DB 오류는 loser 값으로 본다 */
    static <T> List<T> race(int threads, Callable<T> body, T loser) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    try {
                        return body.call();
                    } catch (Exception e) {
                        return loser;
                    }
                }));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();
            List<T> out = new ArrayList<>();
            for (Future<T> f : futures) out.add(f.get(30, TimeUnit.SECONDS));
            return out;
        } finally {
            pool.shutdownNow();
        }
    }
}
