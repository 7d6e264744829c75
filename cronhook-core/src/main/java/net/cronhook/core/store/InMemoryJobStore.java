package net.cronhook.core.store;

import net.cronhook.core.model.Job;
import net.cronhook.core.model.JobPatch;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/** 프로세스 수명 동안만 유지되는 잡 저장소. 모든 연산은 단일 락으로 직렬화 */
public final class InMemoryJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Job create(Job job) {
        lock.lock();
        try {
            if (jobs.containsKey(job.id())) {
                throw new IllegalStateException("Duplicate job id: " + job.id());
            }
            jobs.put(job.id(), job);
        } finally {
            lock.unlock();
        }
        log.debug("Created cron job: {}", job.id());
        return job;
    }

    @Override
    public Optional<Job> findById(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Job> findAll() {
        lock.lock();
        try {
            return List.copyOf(jobs.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Job> update(String id, JobPatch patch) {
        Job updated;
        lock.lock();
        try {
            Job current = jobs.get(id);
            if (current == null) return Optional.empty();
            updated = patch.applyTo(current, clock.now());
            jobs.put(id, updated);
        } finally {
            lock.unlock();
        }
        log.debug("Updated cron job: {}", id);
        return Optional.of(updated);
    }

    @Override
    public boolean delete(String id) {
        boolean deleted;
        lock.lock();
        try {
            deleted = jobs.remove(id) != null;
        } finally {
            lock.unlock();
        }
        if (deleted) log.debug("Deleted cron job: {}", id);
        return deleted;
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            jobs.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Cleared all cron jobs");
    }

    @Override
    public int count() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }
}
