package net.cronbeat.adapter.jdbc.sql;

import net.cronbeat.adapter.jdbc.JdbcUtil;
import net.cronbeat.core.model.JobCriterion;
import net.cronbeat.core.model.JobPatch;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link JobPatch} / {@link JobCriterion} 을 TB_CRON_JOB 용 파라미터 바인딩 SQL 조각으로 렌더링.
 * 컬럼명은 enum 에서만 나오므로 사용자 입력이 SQL 텍스트로 들어가지 않는다.
 */
public final class CronJobSql {
    private CronJobSql() {}

    /** SQL 조각 + 순서대로 바인딩할 값 */
    public record Fragment(String sql, List<Object> params) {
        public static Fragment empty() { return new Fragment("", List.of()); }

        public boolean isEmpty() { return sql.isEmpty(); }
    }

    public static String column(JobPatch.Field f) {
        return switch (f) {
            case ENABLED -> "ENABLED";
            case START_AT -> "START_AT";
            case STOP_AT -> "STOP_AT";
            case LOCKED -> "LOCKED";
            case STARTED_AT -> "STARTED_AT";
            case PROCESSED_AT -> "PROCESSED_AT";
            case LAST_ERROR -> "LAST_ERROR";
        };
    }

    public static String column(JobCriterion.Attribute a) {
        return switch (a) {
            case NAME -> "NAME";
            case KIND -> "KIND";
        };
    }

    /** "COL = ?, COL2 = NULL, PROCESSED_COUNT = PROCESSED_COUNT + 1" (UPDATED_AT 은 호출부에서 덧붙임) */
    public static Fragment setClause(JobPatch patch) {
        var parts = new ArrayList<String>();
        var params = new ArrayList<Object>();
        for (Map.Entry<JobPatch.Field, Object> e : patch.sets().entrySet()) {
            parts.add(column(e.getKey()) + " = ?");
            params.add(toDbValue(e.getKey(), e.getValue()));
        }
        for (JobPatch.Field f : patch.unsets()) {
            parts.add(column(f) + " = NULL");
        }
        if (patch.incrementsProcessedCount()) {
            parts.add("PROCESSED_COUNT = PROCESSED_COUNT + 1");
        }
        return new Fragment(String.join(", ", parts), params);
    }

    /** 각 조건을 AND 로 연결 ("" 이면 조건 없음) */
    public static Fragment where(List<JobCriterion> criteria, String alias) {
        if (criteria == null || criteria.isEmpty()) return Fragment.empty();
        String prefix = alias == null || alias.isEmpty() ? "" : alias + ".";
        var parts = new ArrayList<String>();
        var params = new ArrayList<Object>();
        for (JobCriterion c : criteria) {
            String col = prefix + column(c.attribute());
            switch (c.operator()) {
                case EQ -> parts.add(col + " = ?");
                case NE -> parts.add(col + " <> ?");
                case LIKE -> parts.add(col + " LIKE ?");
                case IN -> parts.add(col + " IN (" + String.join(", ", java.util.Collections.nCopies(c.values().size(), "?")) + ")");
            }
            params.addAll(c.values());
        }
        return new Fragment(String.join(" AND ", parts), params);
    }

    /** idx 부터 바인딩하고 다음 인덱스를 돌려준다 */
    public static int bind(PreparedStatement ps, int idx, List<Object> params) throws SQLException {
        for (Object p : params) {
            if (p instanceof Instant i) {
                JdbcUtil.setInstant(ps, idx++, i);
            } else {
                ps.setObject(idx++, p);
            }
        }
        return idx;
    }

    private static Object toDbValue(JobPatch.Field f, Object v) {
        return switch (f) {
            case ENABLED, LOCKED -> JdbcUtil.yn((Boolean) v);
            case LAST_ERROR -> JdbcUtil.clip((String) v);
            default -> v;
        };
    }
}
