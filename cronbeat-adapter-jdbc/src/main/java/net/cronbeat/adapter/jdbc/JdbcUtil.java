package net.cronbeat.adapter.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Calendar;
import java.util.TimeZone;

/** 시각 컬럼은 모두 UTC 기준 TIMESTAMP 로 저장한다 (JVM/세션 TZ 와 무관) */
public final class JdbcUtil {
    private JdbcUtil() {}

    public static final int MAX_ERROR_LENGTH = 4000;

    private static Calendar utc() {
        return Calendar.getInstance(TimeZone.getTimeZone("UTC"));
    }

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP);
        else ps.setTimestamp(idx, ts(i), utc());
    }

    public static Instant getInstant(ResultSet rs, String col) throws SQLException {
        return toInstant(rs.getTimestamp(col, utc()));
    }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    /** 'Y' → true, 'N' → false, NULL → null */
    public static Boolean flag(String v) {
        if (v == null) return null;
        return "Y".equals(v);
    }

    public static String clip(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) return s;
        return s.substring(0, MAX_ERROR_LENGTH);
    }
}
