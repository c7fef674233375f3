package net.cronbeat.adapter.jdbc.mapper;

import net.cronbeat.adapter.jdbc.JdbcUtil;
import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- TB_CRON_JOB ---
    public static CronJob toCronJob(ResultSet rs) throws SQLException {
        var cron = new CronState(
                JdbcUtil.flag(rs.getString("ENABLED")),
                JdbcUtil.getInstant(rs, "START_AT"),
                JdbcUtil.getInstant(rs, "STOP_AT"),
                rs.getString("INTERVAL_EXPR"),
                "Y".equals(rs.getString("REMOVE_EXPIRED")),
                JdbcUtil.getInstant(rs, "STARTED_AT"),
                JdbcUtil.getInstant(rs, "PROCESSED_AT"),
                rs.getLong("PROCESSED_COUNT"),
                "Y".equals(rs.getString("LOCKED")),
                rs.getString("LAST_ERROR")
        );
        return new CronJob(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("KIND"),
                rs.getString("PAYLOAD"),
                cron,
                JdbcUtil.getInstant(rs, "CREATED_AT"),
                JdbcUtil.getInstant(rs, "UPDATED_AT")
        );
    }
}
