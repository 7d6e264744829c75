package net.cronhook.adapter.jdbc.repo;

import net.cronhook.adapter.jdbc.TxContext;
import net.cronhook.adapter.jdbc.mapper.RowMappers;
import net.cronhook.core.model.RepeatEntry;
import net.cronhook.core.spi.RepeatEntryRepository;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.cronhook.adapter.jdbc.JdbcUtil.setInstant;

public final class JdbcRepeatEntryRepository implements RepeatEntryRepository {
    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Optional<RepeatEntry> findById(String queueName, String entryId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_REPEAT_ENTRY WHERE QUEUE_NAME=? AND ENTRY_ID=?")) {
            ps.setString(1, queueName);
            ps.setString(2, entryId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toRepeatEntry(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<RepeatEntry> findAll(String queueName) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_REPEAT_ENTRY WHERE QUEUE_NAME=? ORDER BY CREATED_AT, ENTRY_ID")) {
            ps.setString(1, queueName);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<RepeatEntry>();
                while (rs.next()) out.add(RowMappers.toRepeatEntry(rs));
                return out;
            }
        }
    }

    @Override
    public boolean insertIfAbsent(RepeatEntry e) throws Exception {
        // 동시 등록 시 PK 충돌은 실패가 아니라 "이미 있음"
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_REPEAT_ENTRY(
                QUEUE_NAME, ENTRY_ID, NAME, PATTERN, TIME_ZONE, NEXT_DUE_AT,
                KEEP_COMPLETED, KEEP_FAILED, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
        """)) {
            ps.setString(1, e.queueName());
            ps.setString(2, e.entryId());
            ps.setString(3, e.name());
            ps.setString(4, e.pattern());
            ps.setString(5, e.timeZone());
            setInstant(ps, 6, e.nextDueAt());
            ps.setInt(7, e.keepCompleted());
            ps.setInt(8, e.keepFailed());
            setInstant(ps, 9, e.createdAt());
            setInstant(ps, 10, e.updatedAt());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean advance(String queueName, String entryId, Instant nextDueAt, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_REPEAT_ENTRY
               SET NEXT_DUE_AT = ?,
                   UPDATED_AT  = ?
             WHERE QUEUE_NAME = ? AND ENTRY_ID = ?
        """)) {
            setInstant(ps, 1, nextDueAt);
            setInstant(ps, 2, now);
            ps.setString(3, queueName);
            ps.setString(4, entryId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean delete(String queueName, String entryId) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "DELETE FROM TB_REPEAT_ENTRY WHERE QUEUE_NAME=? AND ENTRY_ID=?")) {
            ps.setString(1, queueName);
            ps.setString(2, entryId);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public int count(String queueName) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT COUNT(*) FROM TB_REPEAT_ENTRY WHERE QUEUE_NAME=?")) {
            ps.setString(1, queueName);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }
}
