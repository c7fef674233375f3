package net.cronbeat.core.memory;

import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.model.JobCriterion;
import net.cronbeat.core.model.JobPatch;
import net.cronbeat.core.support.MutableClock;
import net.cronbeat.core.support.TestCronCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static net.cronbeat.core.support.TestCronCalculator.EVERY_SECOND;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCronJobRepositoryTest {

    final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    InMemoryCronJobRepository repo;

    @BeforeEach
    void setUp() {
        repo = new InMemoryCronJobRepository(clock, new TestCronCalculator());
    }

    @Test
    void insert_appliesDefaults() {
        var saved = repo.insert(CronJob.ofNew("a", "task", "{}",
                new CronState(null, null, null, EVERY_SECOND, false, null, null, 0, false, null)));
        assertThat(saved.id()).isNotNull();
        assertThat(saved.cron().enabled()).isTrue();
        assertThat(saved.cron().startAt()).isEqualTo(clock.now());
        assertThat(saved.createdAt()).isEqualTo(clock.now());
    }

    @Test
    void insert_rejectsInvalidInterval() {
        assertThatThrownBy(() -> repo.insert(CronJob.ofNew("a", "task", null, CronState.recurring("nope", null))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void claimNext_prefersEarliestStartAt_andLocks() {
        repo.insert(CronJob.ofNew("late", "task", null, CronState.oneShot(clock.now().minusSeconds(1))));
        repo.insert(CronJob.ofNew("early", "task", null, CronState.oneShot(clock.now().minusSeconds(10))));

        Optional<CronJob> first = repo.claimNext(clock.now(), List.of());
        assertThat(first).map(CronJob::name).contains("early");
        assertThat(first.get().cron().locked()).isTrue();
        assertThat(first.get().cron().startedAt()).isEqualTo(clock.now());

        assertThat(repo.claimNext(clock.now(), List.of())).map(CronJob::name).contains("late");
        assertThat(repo.claimNext(clock.now(), List.of())).isEmpty();
    }

    @Test
    void claimNext_respectsEligibilityWindow() {
        repo.insert(CronJob.ofNew("future", "task", null, CronState.oneShot(clock.now().plusSeconds(5))));
        repo.insert(CronJob.ofNew("stopped", "task", null,
                CronState.oneShot(clock.now().minusSeconds(5)).withStopAt(clock.now().minusSeconds(1))));
        repo.insert(CronJob.ofNew("off", "task", null, CronState.oneShot(clock.now()).withEnabled(false)));

        assertThat(repo.claimNext(clock.now(), List.of())).isEmpty();

        clock.advance(Duration.ofSeconds(5));
        assertThat(repo.claimNext(clock.now(), List.of())).map(CronJob::name).contains("future");
    }

    @Test
    void claimNext_stopAtEqualToNow_isStillEligible() {
        repo.insert(CronJob.ofNew("edge", "task", null,
                CronState.oneShot(clock.now().minusSeconds(1)).withStopAt(clock.now())));
        assertThat(repo.claimNext(clock.now(), List.of())).isPresent();
    }

    @Test
    void claimNext_appliesExtraCriteria() {
        repo.insert(CronJob.ofNew("n1", "checklist", null, CronState.oneShot(clock.now())));
        repo.insert(CronJob.ofNew("r1", "reminder", null, CronState.oneShot(clock.now())));

        assertThat(repo.claimNext(clock.now(), List.of(JobCriterion.kindIs("reminder"))))
                .map(CronJob::name).contains("r1");
        assertThat(repo.claimNext(clock.now(), List.of(JobCriterion.kindIs("reminder")))).isEmpty();
    }

    @Test
    void update_appliesPatch_andIgnoresMissingJob() {
        var saved = repo.insert(CronJob.ofNew("a", "task", null, CronState.recurring(EVERY_SECOND, clock.now())));
        repo.claimNext(clock.now(), List.of());
        repo.update(saved.id(), JobPatch.builder().unlock().processedAt(clock.now()).incrementProcessedCount().build());
        repo.update(999L, JobPatch.builder().disable().build());

        var after = repo.findById(saved.id()).orElseThrow();
        assertThat(after.cron().locked()).isFalse();
        assertThat(after.cron().processedCount()).isEqualTo(1);
    }

    @Test
    void upsert_keepsRuntimeState() {
        var saved = repo.upsert("a", "task", "v1", CronState.recurring(EVERY_SECOND, clock.now()));
        repo.update(saved.id(), JobPatch.builder().incrementProcessedCount().lastError("x").build());

        var again = repo.upsert("a", "reminder", "v2",
                CronState.recurring(TestCronCalculator.EVERY_MINUTE, clock.now().plusSeconds(100)).withRemoveExpired(true));
        assertThat(again.id()).isEqualTo(saved.id());
        assertThat(again.kind()).isEqualTo("reminder");
        assertThat(again.payload()).isEqualTo("v2");
        assertThat(again.cron().interval()).isEqualTo(TestCronCalculator.EVERY_MINUTE);
        assertThat(again.cron().removeExpired()).isTrue();
        assertThat(again.cron().startAt()).isEqualTo(saved.cron().startAt());
        assertThat(again.cron().processedCount()).isEqualTo(1);
        assertThat(again.cron().lastError()).isEqualTo("x");
    }

    @Test
    void unlockStale_onlyReleasesOldLocks() {
        repo.insert(CronJob.ofNew("old", "task", null, CronState.oneShot(clock.now())));
        repo.claimNext(clock.now(), List.of());
        clock.advance(Duration.ofMinutes(10));
        repo.insert(CronJob.ofNew("fresh", "task", null, CronState.oneShot(clock.now())));
        repo.claimNext(clock.now(), List.of());

        int n = repo.unlockStale(clock.now().minus(Duration.ofMinutes(5)));
        assertThat(n).isEqualTo(1);
        assertThat(repo.findByName("old").orElseThrow().cron().locked()).isFalse();
        assertThat(repo.findByName("fresh").orElseThrow().cron().locked()).isTrue();
    }

    // 병렬 선점: 8스레드가 20건을 나눠 가져도 중복 없음
    @Test
    void parallelClaims_neverReturnTheSameJobTwice() throws Exception {
        for (int i = 0; i < 20; i++) {
            repo.insert(CronJob.ofNew("t" + i, "task", null, CronState.oneShot(clock.now())));
        }

        ExecutorService es = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        Set<Long> claimedIds = ConcurrentHashMap.newKeySet();
        AtomicInteger totalClaims = new AtomicInteger();

        Runnable worker = () -> {
            try {
                start.await();
                while (true) {
                    Optional<CronJob> opt = repo.claimNext(clock.now(), List.of());
                    if (opt.isEmpty()) break;
                    claimedIds.add(opt.get().id());
                    totalClaims.incrementAndGet();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        for (int i = 0; i < 8; i++) es.submit(worker);
        start.countDown();
        es.shutdown();
        assertThat(es.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(claimedIds).hasSize(20);
        assertThat(totalClaims.get()).isEqualTo(20);
    }
}
