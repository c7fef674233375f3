package net.cronbeat.core.service;

import net.cronbeat.core.event.CronEvents;
import net.cronbeat.core.event.JobErrorEvent;
import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.JobPatch;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronJobRepository;
import net.cronbeat.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 하트비트 실패 분류 → 저장할 상태와 다음 하트비트까지의 지연을 결정.
 * <ul>
 *   <li>선점할 잡 없음: 상태 변경 없이 idleDelay</li>
 *   <li>잡이 있는 실패: lastError 기록, enabled/locked 해제 후 이벤트, tickDelay</li>
 *   <li>잡이 없는 실패: 이벤트만, tickDelay</li>
 * </ul>
 * 복구 저장 자체가 실패하면 잡 컨텍스트 없이 한 단계만 더 내려간다. 이 경로는 저장소를 건드리지 않으므로 더 깊어지지 않는다.
 */
public final class ErrorRecoveryHandler {
    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryHandler.class);

    private final String scheduler;
    private final CronJobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final CronEvents events;
    private final Duration idleDelay;
    private final Duration tickDelay;

    public ErrorRecoveryHandler(String scheduler,
                                CronJobRepository jobs,
                                TxRunner tx,
                                Clock clock,
                                CronEvents events,
                                Duration idleDelay,
                                Duration tickDelay) {
        this.scheduler = scheduler;
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.events = events;
        this.idleDelay = idleDelay;
        this.tickDelay = tickDelay;
    }

    public Duration noEligibleJob() {
        return idleDelay;
    }

    /**
     * @param error 실패 (HANDLER 또는 STORE)
     * @param job   선점했던 잡, 선점 전 실패면 null
     * @return 다음 하트비트까지의 지연
     */
    public Duration recover(CronJobException error, CronJob job) {
        CronJobException current = error;
        if (job != null) {
            try {
                final String message = error.getMessage();
                tx.requiresNew(() -> {
                    jobs.update(job.id(), JobPatch.builder()
                            .lastError(message)
                            .disable()
                            .unlock()
                            .build());
                    return null;
                });
                log.info("[{}] job {} ('{}') disabled after {} failure: {}",
                        scheduler, job.id(), job.name(), error.kind(), message);
                publish(error, job);
                return tickDelay;
            } catch (Exception e) {
                log.error("[{}] failed to record error on job {}, job stays locked", scheduler, job.id(), e);
                current = new CronJobException(CronJobException.Kind.RECOVERY, e);
                current.addSuppressed(error);
            }
        }
        publish(current, null);
        return tickDelay;
    }

    private void publish(CronJobException error, CronJob job) {
        events.jobError(new JobErrorEvent(scheduler, error, Optional.ofNullable(job), clock.now()));
    }
}
