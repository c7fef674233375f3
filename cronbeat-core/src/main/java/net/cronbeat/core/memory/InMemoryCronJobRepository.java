package net.cronbeat.core.memory;

import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.model.JobCriterion;
import net.cronbeat.core.model.JobPatch;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronCalculator;
import net.cronbeat.core.spi.CronJobRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 단일 프로세스용 저장소. 모든 연산이 하나의 모니터 안에서 돌기 때문에 claimNext 는 자연스럽게 원자적이다.
 * 여러 {@link net.cronbeat.core.service.CronScheduler} 가 같은 인스턴스를 공유해도 된다.
 */
public final class InMemoryCronJobRepository implements CronJobRepository {

    private static final Comparator<CronJob> CLAIM_ORDER =
            Comparator.comparing((CronJob j) -> j.cron().startAt()).thenComparing(CronJob::id);

    private final Map<Long, CronJob> rows = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;
    private final CronCalculator cron;

    public InMemoryCronJobRepository(Clock clock, CronCalculator cron) {
        this.clock = clock;
        this.cron = cron;
    }

    @Override
    public synchronized Optional<CronJob> claimNext(Instant now, List<JobCriterion> extra) {
        Optional<CronJob> picked = rows.values().stream()
                .filter(j -> j.cron().isEligibleAt(now))
                .filter(j -> extra.stream().allMatch(c -> c.matches(j)))
                .min(CLAIM_ORDER);
        if (picked.isEmpty()) return Optional.empty();

        CronJob j = picked.get();
        CronJob claimed = touch(j.withCron(JobPatch.builder().lock().startedAt(now).build().applyTo(j.cron())));
        rows.put(claimed.id(), claimed);
        return Optional.of(claimed);
    }

    @Override
    public synchronized void update(long id, JobPatch patch) {
        if (patch.isEmpty()) return;
        CronJob j = rows.get(id);
        if (j == null) return; // 이미 삭제됨: JDBC 의 0건 UPDATE 와 같게
        rows.put(id, touch(j.withCron(patch.applyTo(j.cron()))));
    }

    @Override
    public synchronized void delete(long id) {
        rows.remove(id);
    }

    @Override
    public synchronized Optional<CronJob> findById(long id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized Optional<CronJob> findByName(String name) {
        return rows.values().stream().filter(j -> name.equalsIgnoreCase(j.name())).findFirst();
    }

    @Override
    public synchronized List<CronJob> findAll(List<JobCriterion> criteria) {
        List<CronJob> out = new ArrayList<>();
        for (CronJob j : rows.values()) {
            if (criteria.stream().allMatch(c -> c.matches(j))) out.add(j);
        }
        return out;
    }

    @Override
    public synchronized CronJob insert(CronJob job) {
        if (job.name() == null || job.name().isBlank()) throw new IllegalArgumentException("job name is required");
        if (findByName(job.name()).isPresent()) {
            throw new IllegalStateException("job name already exists: " + job.name());
        }
        CronState state = validated(job.cron()).withDefaults(clock.now());
        Instant now = clock.now();
        CronJob saved = new CronJob(ids.incrementAndGet(), job.name(), job.kind(), job.payload(), state, now, now);
        rows.put(saved.id(), saved);
        return saved;
    }

    @Override
    public synchronized CronJob upsert(String name, String kind, String payload, CronState definition) {
        Optional<CronJob> existing = findByName(name);
        if (existing.isEmpty()) {
            return insert(CronJob.ofNew(name, kind, payload, definition));
        }
        CronJob j = existing.get();
        CronState cur = j.cron();
        CronState def = validated(definition);
        CronState merged = new CronState(cur.enabled(), cur.startAt(), def.stopAt(), def.interval(),
                def.removeExpired(), cur.startedAt(), cur.processedAt(), cur.processedCount(),
                cur.locked(), cur.lastError());
        CronJob updated = touch(new CronJob(j.id(), j.name(), kind, payload, merged, j.createdAt(), j.updatedAt()));
        rows.put(updated.id(), updated);
        return updated;
    }

    @Override
    public synchronized int unlockStale(Instant startedBefore) {
        int n = 0;
        for (CronJob j : List.copyOf(rows.values())) {
            CronState s = j.cron();
            if (s.locked() && s.startedAt() != null && s.startedAt().isBefore(startedBefore)) {
                rows.put(j.id(), touch(j.withCron(s.withLocked(false))));
                n++;
            }
        }
        return n;
    }

    public synchronized int size() {
        return rows.size();
    }

    public synchronized void clear() {
        rows.clear();
    }

    private CronState validated(CronState s) {
        if (s == null) throw new IllegalArgumentException("cron state is required");
        if (s.isRecurring() && !cron.isValid(s.interval())) {
            throw new IllegalArgumentException("invalid cron interval: " + s.interval());
        }
        return s;
    }

    private CronJob touch(CronJob j) {
        return new CronJob(j.id(), j.name(), j.kind(), j.payload(), j.cron(), j.createdAt(), clock.now());
    }
}
