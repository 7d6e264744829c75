package net.cronhook.core.cluster;

import net.cronhook.core.model.QueueRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 공유 큐 소비자. 폴러 스레드 하나가 승격 + 클레임을 하고, 실행은 핸들러 풀에 넘긴다.
 * 빈 슬롯 수만큼만 클레임하므로 lease를 잡은 채 대기하는 런이 없다.
 */
public final class QueueWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final SharedQueue queue;
    private final QueueRunHandler handler;
    private final WorkerOptions options;
    private final String owner;

    private final Semaphore slots;
    private final ScheduledExecutorService poller;
    private final ExecutorService handlers;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public QueueWorker(SharedQueue queue, QueueRunHandler handler, WorkerOptions options, String owner) {
        this.queue = queue;
        this.handler = handler;
        this.options = options;
        this.owner = owner;
        this.slots = new Semaphore(options.concurrency());
        this.poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cronhook-poller-" + queue.name());
            t.setDaemon(true);
            return t;
        });
        AtomicInteger seq = new AtomicInteger();
        this.handlers = Executors.newFixedThreadPool(options.concurrency(), r -> {
            Thread t = new Thread(r, "cronhook-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public String owner() {
        return owner;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        long delayMs = options.pollDelay().toMillis();
        poller.scheduleWithFixedDelay(this::safePoll, 0, delayMs, TimeUnit.MILLISECONDS);
        log.info("Queue worker {} started on {} (concurrency {})", owner, queue.name(), options.concurrency());
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (Exception e) {
            // 다음 폴링에서 다시 시도
            log.error("Queue worker {} poll failed", owner, e);
        }
    }

    /** 폴링 한 번. 넘겨준 런 수를 돌려준다 */
    public int pollOnce() throws Exception {
        if (closed.get()) return 0;
        queue.promoteDue(options.batchSize());

        int dispatched = 0;
        while (!closed.get() && slots.tryAcquire()) {
            Optional<QueueRun> claimed;
            try {
                claimed = queue.claimNext(owner, options.lease());
            } catch (Exception e) {
                slots.release();
                throw e;
            }
            if (claimed.isEmpty()) {
                slots.release();
                break;
            }
            QueueRun run = claimed.get();
            handlers.execute(() -> process(run));
            dispatched++;
        }
        return dispatched;
    }

    private void process(QueueRun run) {
        try {
            handler.handle(run);
            queue.complete(run, owner);
        } catch (Exception e) {
            log.error("Run {} of {} failed", run.id(), run.name(), e);
            try {
                queue.fail(run, owner, e.toString());
            } catch (Exception ex) {
                log.error("Could not mark run {} as failed", run.id(), ex);
            }
        } finally {
            slots.release();
        }
    }

    /** 폴링 중단 후 진행 중 런은 drainTimeout 까지 기다린다. 멱등 */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        long drainMs = options.drainTimeout().toMillis();
        poller.shutdown(); // 진행 중 폴링이 클레임한 런까지 넘긴 뒤 핸들러 풀을 닫는다
        try {
            poller.awaitTermination(drainMs, TimeUnit.MILLISECONDS);
            handlers.shutdown();
            if (!handlers.awaitTermination(drainMs, TimeUnit.MILLISECONDS)) {
                log.warn("Queue worker {} closed with runs still in flight", owner);
            }
        } catch (InterruptedException e) {
            handlers.shutdown();
            Thread.currentThread().interrupt();
        }
        log.info("Queue worker {} closed", owner);
    }
}
