package net.cronbeat.adapter.jdbc;

import net.cronbeat.adapter.jdbc.repo.JdbcCronJobRepository;
import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.spi.CronJobRepository;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 병렬 경합 인수 테스트
 * - 여러 스레드가 각자 새 트랜잭션으로 claimNext 호출
 * - FOR UPDATE SKIP LOCKED + 조건부 UPDATE 로 같은 잡이 두 번 선점되지 않는지 검증
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class ConcurrentClaimAcceptanceTest extends TestSupport {

    CronJobRepository jobs;

    @BeforeAll
    void initRepo() {
        jobs = new JdbcCronJobRepository(clock, everySecond);
    }

    private long seed(String name, Instant startAt) throws Exception {
        return tx.required(() -> jobs.insert(CronJob.ofNew(name, "task", null, CronState.oneShot(startAt)))).id();
    }

    // ========== t1: 선점 가능한 잡 1건 경합 — 한 스레드만 선점 ==========
    @Test
    void t1_concurrent_claimNext_onlyOneWins() throws Exception {
        long jobId = seed("demo", clock.now().minusSeconds(60));

        int threads = 6;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                return tx.requiresNew(() -> jobs.claimNext(clock.now(), List.of())).isPresent();
            }));
        }
        start.countDown();

        int wins = 0;
        for (Future<Boolean> f : futures) wins += f.get(60, TimeUnit.SECONDS) ? 1 : 0;
        es.shutdown();
        assertEquals(1, wins, "exactly one thread should win job claim");

        var j = tx.required(() -> jobs.findById(jobId).orElseThrow());
        assertTrue(j.cron().locked());
        assertNotNull(j.cron().startedAt());
    }

    // ========== t2: 잡 여러 건 — 모두 정확히 한 번씩 선점 ==========
    @Test
    void t2_concurrent_claimNext_eachJobClaimedOnce() throws Exception {
        int jobCount = 10;
        Instant base = clock.now().minusSeconds(120);
        Set<Long> seeded = new HashSet<>();
        for (int i = 0; i < jobCount; i++) seeded.add(seed("job-" + i, base.plusSeconds(i)));

        int threads = 8;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<Long> claimed = new ConcurrentLinkedQueue<>();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                while (claimed.size() < jobCount && System.nanoTime() < deadline) {
                    Optional<CronJob> got = tx.requiresNew(() -> jobs.claimNext(clock.now(), List.of()));
                    got.ifPresent(j -> claimed.add(j.id()));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(60, TimeUnit.SECONDS);
        es.shutdown();

        assertEquals(jobCount, claimed.size(), "every job claimed exactly once");
        assertEquals(seeded, new HashSet<>(claimed));
        assertTrue(tx.requiresNew(() -> jobs.claimNext(clock.now(), List.of())).isEmpty());
    }
}
