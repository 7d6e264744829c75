package net.cronhook.core.spi;

import net.cronhook.core.model.RepeatEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RepeatEntryRepository {
    Optional<RepeatEntry> findById(String queueName, String entryId) throws Exception;
    List<RepeatEntry> findAll(String queueName) throws Exception;

    /** (queue, entryId) 가 이미 있으면 false, 기존 행은 그대로 */
    boolean insertIfAbsent(RepeatEntry entry) throws Exception;

    /** 커서 전진. 엔트리가 이미 지워졌으면 false */
    boolean advance(String queueName, String entryId, Instant nextDueAt, Instant now) throws Exception;
    boolean delete(String queueName, String entryId) throws Exception;
    int count(String queueName) throws Exception;
}
