package net.cronhook.adapter.jdbc.repo;

import net.cronhook.adapter.jdbc.TxContext;
import net.cronhook.adapter.jdbc.mapper.RowMappers;
import net.cronhook.core.model.QueueRun;
import net.cronhook.core.spi.QueueRunRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.cronhook.adapter.jdbc.JdbcUtil.setInstant;

/**
 * 상태 전이는 모두 "WHERE STATUS=기대값" 조건부 UPDATE(CAS)로 한다.
 * 갱신 건수 0 = 다른 프로세스가 먼저 가져감.
 */
public final class JdbcQueueRunRepository implements QueueRunRepository {
    private static final int MAX_ERROR_LENGTH = 4000;

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public long insert(QueueRun r) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_QUEUE_RUN(
                QUEUE_NAME, NAME, ENTRY_ID, JOB_ID, STATUS, AVAILABLE_AT,
                LEASE_OWNER, LEASE_UNTIL, KEEP_COMPLETED, KEEP_FAILED,
                CREATED_AT, UPDATED_AT, FINISHED_AT, LAST_ERROR)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, r.queueName());
            ps.setString(2, r.name());
            ps.setString(3, r.entryId());
            ps.setString(4, r.jobId());
            ps.setString(5, r.status().code());
            setInstant(ps, 6, r.availableAt());
            ps.setString(7, r.leaseOwner());
            setInstant(ps, 8, r.leaseUntil());
            ps.setInt(9, r.keepCompleted());
            ps.setInt(10, r.keepFailed());
            setInstant(ps, 11, r.createdAt());
            setInstant(ps, 12, r.updatedAt());
            setInstant(ps, 13, r.finishedAt());
            ps.setString(14, truncate(r.lastError()));
            ps.executeUpdate();
            try (var k = ps.getGeneratedKeys()) {
                k.next();
                return k.getLong(1);
            }
        }
    }

    @Override
    public Optional<QueueRun> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_QUEUE_RUN WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toQueueRun(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<QueueRun> findDue(String queueName, Instant now, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_QUEUE_RUN
             WHERE QUEUE_NAME = ? AND STATUS = 'DELAYED' AND AVAILABLE_AT <= ?
             ORDER BY AVAILABLE_AT, ID
             LIMIT ?
        """)) {
            ps.setString(1, queueName);
            setInstant(ps, 2, now);
            ps.setInt(3, limit);
            return list(ps);
        }
    }

    @Override
    public List<QueueRun> findByStatus(String queueName, QueueRun.Status status, int offset, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_QUEUE_RUN
             WHERE QUEUE_NAME = ? AND STATUS = ?
             ORDER BY ID
             LIMIT ? OFFSET ?
        """)) {
            ps.setString(1, queueName);
            ps.setString(2, status.code());
            ps.setInt(3, limit);
            ps.setInt(4, offset);
            return list(ps);
        }
    }

    @Override
    public boolean promote(long id, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_QUEUE_RUN
               SET STATUS = 'WAITING',
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'DELAYED'
        """)) {
            setInstant(ps, 1, now);
            ps.setLong(2, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean claim(long id, String owner, Instant leaseUntil, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_QUEUE_RUN
               SET STATUS = 'ACTIVE',
                   LEASE_OWNER = ?,
                   LEASE_UNTIL = ?,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'WAITING'
        """)) {
            ps.setString(1, owner);
            setInstant(ps, 2, leaseUntil);
            setInstant(ps, 3, now);
            ps.setLong(4, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean finish(long id, String owner, QueueRun.Status status, String error, Instant now) throws Exception {
        if (status != QueueRun.Status.COMPLETED && status != QueueRun.Status.FAILED) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_QUEUE_RUN
               SET STATUS = ?,
                   LAST_ERROR = ?,
                   LEASE_UNTIL = NULL,
                   FINISHED_AT = ?,
                   UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'ACTIVE' AND LEASE_OWNER = ?
        """)) {
            ps.setString(1, status.code());
            ps.setString(2, truncate(error));
            setInstant(ps, 3, now);
            setInstant(ps, 4, now);
            ps.setLong(5, id);
            ps.setString(6, owner);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public int trim(String queueName, String entryId, QueueRun.Status status, int keep) throws Exception {
        Connection c = mustConn();
        List<Long> stale = new ArrayList<>();
        try (var ps = c.prepareStatement("""
            SELECT ID FROM TB_QUEUE_RUN
             WHERE QUEUE_NAME = ? AND ENTRY_ID = ? AND STATUS = ?
             ORDER BY ID DESC
        """)) {
            ps.setString(1, queueName);
            ps.setString(2, entryId);
            ps.setString(3, status.code());
            try (var rs = ps.executeQuery()) {
                int seen = 0;
                while (rs.next()) {
                    if (++seen > Math.max(0, keep)) stale.add(rs.getLong(1));
                }
            }
        }
        if (stale.isEmpty()) return 0;

        try (var del = c.prepareStatement("DELETE FROM TB_QUEUE_RUN WHERE ID = ?")) {
            for (Long id : stale) {
                del.setLong(1, id);
                del.addBatch();
            }
            int deleted = 0;
            for (int n : del.executeBatch()) deleted += Math.max(0, n);
            return deleted;
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_QUEUE_RUN WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public int failExpiredLeases(String queueName, Instant now, String reason) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_QUEUE_RUN
               SET STATUS = 'FAILED',
                   LAST_ERROR = ?,
                   FINISHED_AT = ?,
                   UPDATED_AT = ?
             WHERE QUEUE_NAME = ? AND STATUS = 'ACTIVE' AND LEASE_UNTIL < ?
        """)) {
            ps.setString(1, truncate(reason));
            setInstant(ps, 2, now);
            setInstant(ps, 3, now);
            ps.setString(4, queueName);
            setInstant(ps, 5, now);
            return ps.executeUpdate();
        }
    }

    private static List<QueueRun> list(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            var out = new ArrayList<QueueRun>();
            while (rs.next()) out.add(RowMappers.toQueueRun(rs));
            return out;
        }
    }

    private static String truncate(String s) {
        return s == null || s.length() <= MAX_ERROR_LENGTH ? s : s.substring(0, MAX_ERROR_LENGTH);
    }
}
