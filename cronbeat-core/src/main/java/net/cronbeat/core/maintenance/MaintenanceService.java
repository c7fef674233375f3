package net.cronbeat.core.maintenance;

import net.cronbeat.core.model.JobPatch;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronJobRepository;
import net.cronbeat.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * 운영자가 명시적으로 호출하는 복구 작업. 스스로 주기 실행하지 않는다 (잠금 만료/lease 없음).
 */
public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final CronJobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(CronJobRepository jobs, TxRunner tx, Clock clock) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
    }

    /** 실패로 비활성화된 잡을 다시 켠다: enabled=true, lastError/locked 해제 */
    public void reenable(long jobId) throws Exception {
        tx.required(() -> {
            jobs.findById(jobId).orElseThrow(() -> new IllegalArgumentException("job not found: " + jobId));
            jobs.update(jobId, JobPatch.builder()
                    .enabled(true)
                    .clearLastError()
                    .unlock()
                    .build());
            return null;
        });
        log.info("job {} re-enabled by operator", jobId);
    }

    /**
     * startedAt 이 olderThan 보다 오래된 잠금 해제.
     * 해당 인스턴스가 정말 죽었는지는 호출자가 판단해야 한다. 살아 있으면 같은 잡이 중복 실행될 수 있다.
     */
    public MaintenanceReport unlockStale(Duration olderThan) throws Exception {
        if (olderThan == null || olderThan.isNegative()) {
            throw new IllegalArgumentException("olderThan must be zero or positive");
        }
        Instant now = clock.now();
        Instant threshold = now.minus(olderThan);
        MaintenanceReport r = new MaintenanceReport();
        r.unlocked = tx.required(() -> jobs.unlockStale(threshold));
        r.threshold = threshold;
        r.timestamp = now;
        if (r.unlocked > 0) log.warn("unlocked {} stale job(s) started before {}", r.unlocked, threshold);
        return r;
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public Instant threshold;
        public int unlocked;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", threshold=" + threshold +
                    ", unlocked=" + unlocked +
                    '}';
        }
    }
}
