package net.cronbeat.core.maintenance;

import net.cronbeat.core.memory.InMemoryCronJobRepository;
import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.model.JobPatch;
import net.cronbeat.core.spi.TxRunner;
import net.cronbeat.core.support.MutableClock;
import net.cronbeat.core.support.TestCronCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaintenanceServiceTest {

    final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    InMemoryCronJobRepository repo;
    MaintenanceService maintenance;

    @BeforeEach
    void setUp() {
        repo = new InMemoryCronJobRepository(clock, new TestCronCalculator());
        maintenance = new MaintenanceService(repo, TxRunner.direct(), clock);
    }

    @Test
    void reenable_clearsFailureState() throws Exception {
        var saved = repo.insert(CronJob.ofNew("a", "task", null, CronState.oneShot(clock.now())));
        repo.update(saved.id(), JobPatch.builder().disable().lastError("ohhoh").build());

        maintenance.reenable(saved.id());

        var after = repo.findById(saved.id()).orElseThrow();
        assertThat(after.cron().isEnabled()).isTrue();
        assertThat(after.cron().lastError()).isNull();
        assertThat(repo.claimNext(clock.now(), List.of())).isPresent();
    }

    @Test
    void reenable_unknownJob_fails() {
        assertThatThrownBy(() -> maintenance.reenable(42L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("42");
    }

    @Test
    void unlockStale_reportsCount() throws Exception {
        repo.insert(CronJob.ofNew("a", "task", null, CronState.oneShot(clock.now())));
        repo.claimNext(clock.now(), List.of());
        clock.advance(Duration.ofHours(1));

        var report = maintenance.unlockStale(Duration.ofMinutes(30));
        assertThat(report.unlocked).isEqualTo(1);
        assertThat(report.threshold).isEqualTo(clock.now().minus(Duration.ofMinutes(30)));
        assertThat(maintenance.unlockStale(Duration.ofMinutes(30)).unlocked).isZero();
    }

    @Test
    void unlockStale_rejectsNegativeAge() {
        assertThatThrownBy(() -> maintenance.unlockStale(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
