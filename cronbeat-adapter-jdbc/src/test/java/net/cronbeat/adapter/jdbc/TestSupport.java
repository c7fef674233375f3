package net.cronbeat.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronCalculator;
import net.cronbeat.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.utility.DockerImageName;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * ORACLE_JDBC_URL 이 있으면 그 DB 를, 없으면 Testcontainers Oracle XE 를 띄운다.
 * 둘 다 불가능하면 (Docker 없음) 테스트 클래스 전체를 건너뛴다.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static final String EVERY_SECOND = "* * * * * *";

    protected DataSource ds;
    protected OracleContainer oracle;
    protected TxRunner tx;

    // TIMESTAMP(6) 에 그대로 들어가도록 밀리초 정밀도
    protected final Clock clock = () -> Instant.now().truncatedTo(ChronoUnit.MILLIS);

    /** 테스트용 해석기: 매초 식만 이해한다 */
    protected final CronCalculator everySecond = new CronCalculator() {
        @Override
        public Optional<Instant> next(Instant after, String cronExpr, ZoneId zone) {
            if (!isValid(cronExpr)) throw new IllegalArgumentException("unsupported expression: " + cronExpr);
            return Optional.of(after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1));
        }

        @Override
        public boolean isValid(String cronExpr) {
            return EVERY_SECOND.equals(cronExpr);
        }
    };

    @BeforeAll
    void setupDb() {
        String url = System.getenv("ORACLE_JDBC_URL");
        String user = System.getenv("ORACLE_USERNAME");
        String pass = System.getenv("ORACLE_PASSWORD");

        if (url == null || url.isBlank()) {
            assumeTrue(dockerAvailable(), "Docker not available and ORACLE_JDBC_URL not set");
            // Testcontainers Oracle XE (gvenzl/oracle-xe)
            oracle = new OracleContainer(DockerImageName.parse("gvenzl/oracle-xe:21-slim"))
                    .withStartupTimeout(Duration.ofMinutes(5));
            oracle.start();

            url = oracle.getJdbcUrl();
            user = Optional.ofNullable(oracle.getUsername()).orElse("system");
            pass = Optional.ofNullable(oracle.getPassword()).orElse("oracle");
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(10);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        cfg.setDriverClassName("oracle.jdbc.OracleDriver");
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/oracle")
                .baselineOnMigrate(true)
                .load()
                .migrate();

        tx = new JdbcTxRunner(ds);
    }

    @BeforeEach
    void truncate() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.require().createStatement()) {
                st.execute("DELETE FROM TB_CRON_JOB");
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
        if (oracle != null) oracle.stop();
    }

    private static boolean dockerAvailable() {
        try {
            return DockerClientFactory.instance().isDockerAvailable();
        } catch (RuntimeException e) {
            return false;
        }
    }
}
