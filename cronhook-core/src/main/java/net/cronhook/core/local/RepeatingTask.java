package net.cronhook.core.local;

import net.cronhook.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * 취소 가능한 반복 작업. 다음 발화는 본문이 끝난 뒤에 예약하므로 같은 작업끼리 겹치지 않는다.
 */
final class RepeatingTask {
    private static final Logger log = LoggerFactory.getLogger(RepeatingTask.class);

    private final String name;
    private final Runnable body;
    private final UnaryOperator<Instant> nextFire; // 기준 시각 -> 다음 발화 시각
    private final ScheduledExecutorService timer;
    private final Clock clock;

    private ScheduledFuture<?> pending;
    private Instant lastPlanned;
    private boolean stopped = true;

    RepeatingTask(String name,
                  Runnable body,
                  UnaryOperator<Instant> nextFire,
                  ScheduledExecutorService timer,
                  Clock clock) {
        this.name = name;
        this.body = body;
        this.nextFire = nextFire;
        this.timer = timer;
        this.clock = clock;
    }

    synchronized void start() {
        stopped = false;
        arm();
    }

    synchronized void stop() {
        stopped = true;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    synchronized boolean isRunning() {
        return !stopped;
    }

    synchronized Instant nextPlanned() {
        return lastPlanned;
    }

    // lock 보유 상태에서 호출
    private void arm() {
        Instant now = clock.now();
        // 타이머가 조금 일찍 깨어나도 같은 슬롯을 두 번 잡지 않도록 직전 계획 시각 이후로 계산
        Instant base = lastPlanned != null && lastPlanned.isAfter(now) ? lastPlanned : now;
        Instant next = nextFire.apply(base);
        long delayMs = Math.max(0L, Duration.between(now, next).toMillis());
        pending = timer.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
        lastPlanned = next;
    }

    private void fire() {
        synchronized (this) {
            if (stopped) return;
        }
        try {
            body.run();
        } catch (RuntimeException e) {
            log.error("Task {} failed", name, e);
        }
        synchronized (this) {
            if (stopped) return;
            try {
                arm();
            } catch (RuntimeException e) {
                stopped = true;
                log.error("Task {} could not be re-armed and is stopped", name, e);
            }
        }
    }
}
