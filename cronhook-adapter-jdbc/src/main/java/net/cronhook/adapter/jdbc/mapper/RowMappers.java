package net.cronhook.adapter.jdbc.mapper;

import net.cronhook.core.model.QueueRun;
import net.cronhook.core.model.RepeatEntry;

import java.sql.ResultSet;
import java.sql.SQLException;

import static net.cronhook.adapter.jdbc.JdbcUtil.getInstant;

public final class RowMappers {
    private RowMappers() {}

    // --- RepeatEntry ---
    public static RepeatEntry toRepeatEntry(ResultSet rs) throws SQLException {
        return new RepeatEntry(
                rs.getString("QUEUE_NAME"),
                rs.getString("ENTRY_ID"),
                rs.getString("NAME"),
                rs.getString("PATTERN"),
                rs.getString("TIME_ZONE"),
                getInstant(rs, "NEXT_DUE_AT"),
                rs.getInt("KEEP_COMPLETED"),
                rs.getInt("KEEP_FAILED"),
                getInstant(rs, "CREATED_AT"),
                getInstant(rs, "UPDATED_AT")
        );
    }

    // --- QueueRun ---
    public static QueueRun toQueueRun(ResultSet rs) throws SQLException {
        return new QueueRun(
                rs.getLong("ID"),
                rs.getString("QUEUE_NAME"),
                rs.getString("NAME"),
                rs.getString("ENTRY_ID"),
                rs.getString("JOB_ID"),
                QueueRun.Status.from(rs.getString("STATUS")),
                getInstant(rs, "AVAILABLE_AT"),
                rs.getString("LEASE_OWNER"),
                getInstant(rs, "LEASE_UNTIL"),
                rs.getInt("KEEP_COMPLETED"),
                rs.getInt("KEEP_FAILED"),
                getInstant(rs, "CREATED_AT"),
                getInstant(rs, "UPDATED_AT"),
                getInstant(rs, "FINISHED_AT"),
                rs.getString("LAST_ERROR")
        );
    }
}
