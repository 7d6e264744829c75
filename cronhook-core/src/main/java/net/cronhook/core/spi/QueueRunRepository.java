package net.cronhook.core.spi;

import net.cronhook.core.model.QueueRun;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface QueueRunRepository {
    long insert(QueueRun run) throws Exception;
    Optional<QueueRun> findById(long id) throws Exception;

    /** DELAYED 이면서 available_at <= now, 오래된 순 */
    List<QueueRun> findDue(String queueName, Instant now, int limit) throws Exception;

    /** 상태 버킷 조회, id 오름차순 */
    List<QueueRun> findByStatus(String queueName, QueueRun.Status status, int offset, int limit) throws Exception;

    /** DELAYED -> WAITING. 다른 프로세스가 먼저 바꿨으면 false */
    boolean promote(long id, Instant now) throws Exception;

    /** WAITING -> ACTIVE + lease. 다른 워커가 먼저 가져갔으면 false */
    boolean claim(long id, String owner, Instant leaseUntil, Instant now) throws Exception;

    /** ACTIVE(owner 일치) -> COMPLETED/FAILED */
    boolean finish(long id, String owner, QueueRun.Status status, String error, Instant now) throws Exception;

    /** 엔트리의 해당 버킷을 최신 keep 건만 남기고 삭제 */
    int trim(String queueName, String entryId, QueueRun.Status status, int keep) throws Exception;

    boolean delete(long id) throws Exception;

    /** lease 만료된 ACTIVE -> FAILED (재전달 없음) */
    int failExpiredLeases(String queueName, Instant now, String reason) throws Exception;
}
