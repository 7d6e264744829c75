package net.cronhook.core.spi;

import net.cronhook.core.model.Job;
import net.cronhook.core.model.JobPatch;

import java.util.List;
import java.util.Optional;

public interface JobStore {
    Job create(Job job);
    Optional<Job> findById(String id);
    List<Job> findAll();

    /** 병합 + updatedAt 갱신. 없는 id면 empty */
    Optional<Job> update(String id, JobPatch patch);

    boolean delete(String id);
    void clear();
    int count();
}
