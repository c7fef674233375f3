package net.cronbeat.adapter.jdbc.repo;

import net.cronbeat.adapter.jdbc.JdbcUtil;
import net.cronbeat.adapter.jdbc.TxContext;
import net.cronbeat.adapter.jdbc.mapper.RowMappers;
import net.cronbeat.adapter.jdbc.sql.CronJobSql;
import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.model.JobCriterion;
import net.cronbeat.core.model.JobPatch;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronCalculator;
import net.cronbeat.core.spi.CronJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Oracle TB_CRON_JOB 저장소. 모든 메서드는 {@link TxContext} 의 커넥션을 사용한다.
 */
public final class JdbcCronJobRepository implements CronJobRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcCronJobRepository.class);

    /** 한 번의 선점에서 후보로 훑는 행 수 (앞쪽이 다른 인스턴스에 잠겨 있으면 다음 후보로) */
    static final int CLAIM_WINDOW = 16;

    private final Clock clock;
    private final CronCalculator cron;

    public JdbcCronJobRepository(Clock clock, CronCalculator cron) {
        this.clock = clock;
        this.cron = cron;
    }

    @Override
    public Optional<CronJob> claimNext(Instant now, List<JobCriterion> extra) throws Exception {
        Connection c = TxContext.require();
        CronJobSql.Fragment cond = CronJobSql.where(extra, "j2");

        // 선점 가능한 후보를 startAt 순으로 골라 행 잠금, 잠긴 행은 건너뜀
        String sql = """
            SELECT  j.ID
            FROM    TB_CRON_JOB j
            WHERE   j.ROWID IN (
                SELECT rid
                FROM (
                    SELECT  j2.ROWID AS rid
                    FROM    TB_CRON_JOB j2
                    WHERE   j2.ENABLED = 'Y'
                      AND   j2.LOCKED IS NULL
                      AND   j2.START_AT <= ?
                      AND  (j2.STOP_AT IS NULL OR j2.STOP_AT >= ?)
                      %s
                    ORDER BY j2.START_AT ASC, j2.ID ASC
                    FETCH FIRST %d ROWS ONLY
                )
            )
            ORDER BY j.START_AT ASC, j.ID ASC
            FOR UPDATE OF j.LOCKED SKIP LOCKED
            """.formatted(cond.isEmpty() ? "" : "AND " + cond.sql(), CLAIM_WINDOW);

        long id;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            JdbcUtil.setInstant(ps, 1, now);
            JdbcUtil.setInstant(ps, 2, now);
            CronJobSql.bind(ps, 3, cond.params());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                id = rs.getLong("ID");
            }
        }

        try (PreparedStatement upd = c.prepareStatement("""
                UPDATE TB_CRON_JOB
                   SET LOCKED     = 'Y',
                       STARTED_AT = ?,
                       UPDATED_AT = ?
                 WHERE ID = ?
                   AND LOCKED IS NULL
            """)) {
            JdbcUtil.setInstant(upd, 1, now);
            JdbcUtil.setInstant(upd, 2, clock.now());
            upd.setLong(3, id);
            if (upd.executeUpdate() == 0) {
                // 행 잠금을 잡았는데도 0건이면 이미 다른 쪽이 잠근 뒤 커밋한 것
                return Optional.empty();
            }
        }
        return findById(id);
    }

    @Override
    public void update(long id, JobPatch patch) throws Exception {
        if (patch.isEmpty()) return;
        CronJobSql.Fragment set = CronJobSql.setClause(patch);
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "UPDATE TB_CRON_JOB SET " + set.sql() + ", UPDATED_AT = ? WHERE ID = ?")) {
            int i = CronJobSql.bind(ps, 1, set.params());
            JdbcUtil.setInstant(ps, i++, clock.now());
            ps.setLong(i, id);
            if (ps.executeUpdate() == 0) {
                log.debug("update skipped, TB_CRON_JOB ID={} no longer exists", id);
            }
        }
    }

    @Override
    public void delete(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("DELETE FROM TB_CRON_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<CronJob> findById(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_CRON_JOB
                WHERE ID = ?
            """)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toCronJob(rs));
            }
        }
    }

    @Override
    public Optional<CronJob> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_CRON_JOB
                WHERE UPPER(NAME) = UPPER(?)
            """)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toCronJob(rs));
            }
        }
    }

    @Override
    public List<CronJob> findAll(List<JobCriterion> criteria) throws Exception {
        CronJobSql.Fragment cond = CronJobSql.where(criteria, null);
        String sql = "SELECT * FROM TB_CRON_JOB"
                + (cond.isEmpty() ? "" : " WHERE " + cond.sql())
                + " ORDER BY ID";
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
            CronJobSql.bind(ps, 1, cond.params());
            try (ResultSet rs = ps.executeQuery()) {
                List<CronJob> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toCronJob(rs));
                return out;
            }
        }
    }

    @Override
    public CronJob insert(CronJob job) throws Exception {
        if (job.name() == null || job.name().isBlank()) throw new IllegalArgumentException("job name is required");
        Instant now = clock.now();
        CronState s = validated(job.cron()).withDefaults(now);

        if (findByName(job.name()).isPresent()) {
            throw new IllegalStateException("job name already exists: " + job.name());
        }
        long id;
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_CRON_JOB
                    (NAME, KIND, PAYLOAD, ENABLED, START_AT, STOP_AT, INTERVAL_EXPR, REMOVE_EXPIRED,
                     STARTED_AT, PROCESSED_AT, PROCESSED_COUNT, LOCKED, LAST_ERROR, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, new String[]{"ID"})) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, job.kind());
            ps.setString(i++, job.payload());
            ps.setString(i++, JdbcUtil.yn(s.isEnabled()));
            JdbcUtil.setInstant(ps, i++, s.startAt());
            JdbcUtil.setInstant(ps, i++, s.stopAt());
            ps.setString(i++, s.interval());
            ps.setString(i++, JdbcUtil.yn(s.removeExpired()));
            JdbcUtil.setInstant(ps, i++, s.startedAt());
            JdbcUtil.setInstant(ps, i++, s.processedAt());
            ps.setLong(i++, s.processedCount());
            if (s.locked()) ps.setString(i++, "Y"); else ps.setNull(i++, Types.CHAR);
            ps.setString(i++, JdbcUtil.clip(s.lastError()));
            JdbcUtil.setInstant(ps, i++, now);
            JdbcUtil.setInstant(ps, i, now);
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                k.next();
                id = k.getLong(1);
            }
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new IllegalStateException("job name already exists: " + job.name(), e);
        }
        return findById(id).orElseThrow(() -> new IllegalStateException("insert failed to load job: " + job.name()));
    }

    @Override
    public CronJob upsert(String name, String kind, String payload, CronState definition) throws Exception {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("job name is required");
        Instant now = clock.now();
        CronState def = validated(definition).withDefaults(now);

        // name 기준 MERGE. 기존 행은 정의 필드만 갱신하고 enabled/startAt/런타임 필드는 그대로 둔다
        var sql = """
            MERGE INTO TB_CRON_JOB d
            USING (SELECT ? NAME FROM dual) s
               ON (UPPER(d.NAME) = UPPER(s.NAME))
            WHEN MATCHED THEN UPDATE SET
                 KIND           = ?,
                 PAYLOAD        = ?,
                 INTERVAL_EXPR  = ?,
                 STOP_AT        = ?,
                 REMOVE_EXPIRED = ?,
                 UPDATED_AT     = ?
            WHEN NOT MATCHED THEN INSERT
                 (NAME, KIND, PAYLOAD, ENABLED, START_AT, STOP_AT, INTERVAL_EXPR, REMOVE_EXPIRED,
                  PROCESSED_COUNT, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?)
            """;

        try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, name);
            ps.setString(i++, kind);
            ps.setString(i++, payload);
            ps.setString(i++, def.interval());
            JdbcUtil.setInstant(ps, i++, def.stopAt());
            ps.setString(i++, JdbcUtil.yn(def.removeExpired()));
            JdbcUtil.setInstant(ps, i++, now);
            ps.setString(i++, name);
            ps.setString(i++, kind);
            ps.setString(i++, payload);
            ps.setString(i++, JdbcUtil.yn(def.isEnabled()));
            JdbcUtil.setInstant(ps, i++, def.startAt());
            JdbcUtil.setInstant(ps, i++, def.stopAt());
            ps.setString(i++, def.interval());
            ps.setString(i++, JdbcUtil.yn(def.removeExpired()));
            JdbcUtil.setInstant(ps, i++, now);
            JdbcUtil.setInstant(ps, i, now);
            ps.executeUpdate();
        }
        // 갱신된 행을 다시 로드해서 반환
        return findByName(name).orElseThrow(() -> new IllegalStateException("upsert failed to load job: " + name));
    }

    @Override
    public int unlockStale(Instant startedBefore) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_CRON_JOB
                   SET LOCKED     = NULL,
                       UPDATED_AT = ?
                 WHERE LOCKED = 'Y'
                   AND STARTED_AT < ?
            """)) {
            JdbcUtil.setInstant(ps, 1, clock.now());
            JdbcUtil.setInstant(ps, 2, startedBefore);
            return ps.executeUpdate();
        }
    }

    private CronState validated(CronState s) {
        if (s == null) throw new IllegalArgumentException("cron state is required");
        if (s.isRecurring() && !cron.isValid(s.interval())) {
            throw new IllegalArgumentException("invalid cron interval: " + s.interval());
        }
        return s;
    }
}
