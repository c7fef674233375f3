package net.cronbeat.adapter.jdbc;

import net.cronbeat.adapter.jdbc.repo.JdbcCronJobRepository;
import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.service.CronJobHandler;
import net.cronbeat.core.service.CronScheduler;
import net.cronbeat.core.service.CronSchedulerConfig;
import net.cronbeat.core.spi.CronJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 같은 DB 를 보는 스케줄러 두 개가 잡을 나눠 처리하고, 한 잡이 동시에 두 번 돌지 않는지 검증
 */
class SchedulerFlowAcceptanceTest extends TestSupport {

    CronJobRepository jobs;
    final List<CronScheduler> schedulers = new CopyOnWriteArrayList<>();

    @BeforeAll
    void initRepo() {
        jobs = new JdbcCronJobRepository(clock, everySecond);
    }

    @AfterEach
    void stopAll() {
        schedulers.forEach(CronScheduler::close);
        schedulers.clear();
    }

    private CronScheduler scheduler(String name, CronJobHandler handler) {
        var cfg = CronSchedulerConfig.builder(handler)
                .name(name)
                .idleDelay(Duration.ofMillis(50))
                .build();
        var s = new CronScheduler(cfg, jobs, tx, clock, everySecond);
        schedulers.add(s);
        return s;
    }

    @Test
    void twoSchedulers_shareJobs_withoutOverlap() throws Exception {
        for (int i = 0; i < 4; i++) {
            String name = "rec-" + i;
            tx.required(() -> jobs.insert(CronJob.ofNew(name, "task", null, CronState.recurring(EVERY_SECOND, null))));
        }
        long oneShot = tx.required(() -> jobs.insert(CronJob.ofNew("once", "task", null, CronState.oneShot(null)))).id();

        Set<Long> inFlight = ConcurrentHashMap.newKeySet();
        AtomicInteger overlaps = new AtomicInteger();
        Map<String, AtomicInteger> byScheduler = new ConcurrentHashMap<>();

        for (String name : List.of("node-a", "node-b")) {
            scheduler(name, CronJobHandler.sync(job -> {
                if (!inFlight.add(job.id())) overlaps.incrementAndGet();
                try {
                    Thread.sleep(30);
                } finally {
                    inFlight.remove(job.id());
                }
                byScheduler.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
            })).start();
        }

        await().atMost(Duration.ofSeconds(30)).until(() ->
                tx.required(() -> jobs.findAll(List.of())).stream()
                        .filter(j -> j.cron().isRecurring())
                        .allMatch(j -> j.cron().processedCount() >= 3));

        schedulers.forEach(CronScheduler::stop);

        assertEquals(0, overlaps.get(), "a job must never run twice at the same time");
        assertTrue(byScheduler.values().stream().mapToInt(AtomicInteger::get).sum() >= 4 * 3 + 1);

        CronJob once = tx.required(() -> jobs.findById(oneShot).orElseThrow());
        assertEquals(1, once.cron().processedCount());
        assertEquals(Boolean.FALSE, once.cron().enabled());
        assertFalse(once.cron().locked());
        assertNull(once.cron().lastError());
    }

    @Test
    void handlerFailure_disablesJob_andRecordsError() throws Exception {
        long id = tx.required(() -> jobs.insert(CronJob.ofNew("broken", "task", null,
                CronState.recurring(EVERY_SECOND, null)))).id();

        scheduler("node-err", CronJobHandler.sync(job -> { throw new IllegalStateException("smtp down"); })).start();

        await().atMost(Duration.ofSeconds(15)).until(() ->
                "smtp down".equals(tx.required(() -> jobs.findById(id).orElseThrow()).cron().lastError()));

        CronJob j = tx.required(() -> jobs.findById(id).orElseThrow());
        assertEquals(Boolean.FALSE, j.cron().enabled());
        assertFalse(j.cron().locked());
    }
}
