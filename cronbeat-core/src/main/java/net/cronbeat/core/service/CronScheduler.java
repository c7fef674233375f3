package net.cronbeat.core.service;

import net.cronbeat.core.event.CronEvents;
import net.cronbeat.core.event.TickEvent;
import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.JobPatch;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronCalculator;
import net.cronbeat.core.spi.CronJobRepository;
import net.cronbeat.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 인스턴스 하나의 하트비트 루프: 선점 → 핸들러 → 재스케줄(또는 복구) → 다음 하트비트 예약.
 * <p>인스턴스당 하트비트는 항상 하나만 진행된다. 다음 하트비트는 이전 핸들러와 후처리가 끝난 뒤에만 예약된다.
 * 인스턴스 간 상호 배제는 저장소의 {@link CronJobRepository#claimNext} 에만 의존한다.
 * <p>핸들러 타임아웃은 없다. 멈춘 핸들러는 이 인스턴스의 이후 선점만 막는다.
 */
public final class CronScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    private final CronSchedulerConfig config;
    private final CronJobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final ScheduleCalculator schedule;
    private final ErrorRecoveryHandler recovery;
    private final CronEvents events = new CronEvents();
    private final ScheduledExecutorService executor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    // start 마다 증가. 이전 세대의 완료 콜백이 새 루프와 겹쳐 예약하지 못하게 한다
    private final AtomicLong generation = new AtomicLong();
    private final Object heartbeatLock = new Object();
    private ScheduledFuture<?> heartbeat;

    public CronScheduler(CronSchedulerConfig config,
                         CronJobRepository jobs,
                         TxRunner tx,
                         Clock clock,
                         CronCalculator cron) {
        this.config = config;
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.schedule = new ScheduleCalculator(cron, clock, config.nextDelay(), config.zone());
        this.recovery = new ErrorRecoveryHandler(config.name(), jobs, tx, clock, events,
                config.idleDelay(), config.tickDelay());
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cronbeat-" + config.name());
            t.setDaemon(true);
            return t;
        });
    }

    public String name() {
        return config.name();
    }

    public CronSchedulerConfig config() {
        return config;
    }

    public CronEvents events() {
        return events;
    }

    public boolean isRunning() {
        return running.get();
    }

    public CronScheduler start() {
        return start(Duration.ZERO);
    }

    /** 실행 중이면 아무것도 하지 않는다 */
    public CronScheduler start(Duration initialDelay) {
        if (executor.isShutdown()) throw new IllegalStateException("scheduler '" + name() + "' is closed");
        if (!running.compareAndSet(false, true)) return this;

        long epoch = generation.incrementAndGet();
        log.info("[{}] cron scheduler started {}", name(), config);
        scheduleNext(epoch, initialDelay == null ? Duration.ZERO : initialDelay);
        return this;
    }

    /** 대기 중인 하트비트만 취소. 진행 중인 핸들러는 끝까지 돌고 결과도 저장된다 */
    public CronScheduler stop() {
        if (running.compareAndSet(true, false)) {
            synchronized (heartbeatLock) {
                if (heartbeat != null) heartbeat.cancel(false);
                heartbeat = null;
            }
            log.info("[{}] cron scheduler stopped", name());
        }
        return this;
    }

    @Override
    public void close() {
        stop();
        executor.shutdown();
    }

    /** 지금 처리를 마쳤다고 가정할 때의 다음 startAt */
    public Optional<Instant> nextStart(CronJob job) {
        return schedule.nextStart(job);
    }

    private boolean isCurrent(long epoch) {
        return running.get() && generation.get() == epoch;
    }

    private void scheduleNext(long epoch, Duration delay) {
        if (!isCurrent(epoch)) return;
        synchronized (heartbeatLock) {
            try {
                heartbeat = executor.schedule(() -> tick(epoch), delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("[{}] executor closed, heartbeat not scheduled", name());
            }
        }
    }

    private void tick(long epoch) {
        if (!isCurrent(epoch)) return;
        try {
            Instant tickAt = clock.now();
            Optional<CronJob> claimed;
            try {
                claimed = tx.requiresNew(() -> jobs.claimNext(tickAt, config.addToQuery()));
            } catch (Exception e) {
                log.error("[{}] claim failed", name(), e);
                Duration delay = recovery.recover(new CronJobException(CronJobException.Kind.STORE, e), null);
                finish(epoch, TickEvent.Outcome.FAILED, null, delay);
                return;
            }

            if (claimed.isEmpty()) {
                finish(epoch, TickEvent.Outcome.IDLE, null, recovery.noEligibleJob());
                return;
            }

            CronJob job = claimed.get();
            log.debug("[{}] claimed job {} ('{}')", name(), job.id(), job.name());
            invoke(job).whenComplete((result, err) -> afterHandle(epoch, job, err));
        } catch (RuntimeException e) {
            // 어떤 경우에도 루프는 멈추지 않는다
            log.error("[{}] unexpected heartbeat failure", name(), e);
            finish(epoch, TickEvent.Outcome.FAILED, null, config.tickDelay());
        }
    }

    private CompletionStage<?> invoke(CronJob job) {
        try {
            CompletionStage<?> stage = config.handler().handle(job);
            return stage == null ? CompletableFuture.completedFuture(null) : stage;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void afterHandle(long epoch, CronJob job, Throwable err) {
        try {
            if (err != null) {
                Throwable cause = unwrap(err);
                log.warn("[{}] handler failed on job {} ('{}')", name(), job.id(), job.name(), cause);
                Duration delay = recovery.recover(new CronJobException(CronJobException.Kind.HANDLER, cause), job);
                finish(epoch, TickEvent.Outcome.FAILED, job.id(), delay);
                return;
            }
            try {
                reschedule(job);
            } catch (Exception e) {
                log.error("[{}] reschedule failed on job {}", name(), job.id(), e);
                Duration delay = recovery.recover(new CronJobException(CronJobException.Kind.STORE, e), job);
                finish(epoch, TickEvent.Outcome.FAILED, job.id(), delay);
                return;
            }
            finish(epoch, TickEvent.Outcome.PROCESSED, job.id(), config.tickDelay());
        } catch (RuntimeException e) {
            log.error("[{}] unexpected failure after handling job {}", name(), job.id(), e);
            finish(epoch, TickEvent.Outcome.FAILED, job.id(), config.tickDelay());
        }
    }

    /** 다음 발생이 있으면 startAt 전진, 없으면 비활성화 또는 삭제(removeExpired) */
    private void reschedule(CronJob job) throws Exception {
        Optional<Instant> next = schedule.nextStart(job);
        Instant now = clock.now();
        tx.requiresNew(() -> {
            if (next.isPresent()) {
                jobs.update(job.id(), JobPatch.builder()
                        .unlock()
                        .clearLastError()
                        .processedAt(now)
                        .startAt(next.get())
                        .incrementProcessedCount()
                        .build());
                log.debug("[{}] job {} next start {}", name(), job.id(), next.get());
            } else if (job.cron().removeExpired()) {
                jobs.delete(job.id());
                log.debug("[{}] job {} expired and removed", name(), job.id());
            } else {
                jobs.update(job.id(), JobPatch.builder()
                        .unlock()
                        .clearLastError()
                        .disable()
                        .processedAt(now)
                        .incrementProcessedCount()
                        .build());
                log.debug("[{}] job {} has no further occurrence, disabled", name(), job.id());
            }
            return null;
        });
    }

    private void finish(long epoch, TickEvent.Outcome outcome, Long jobId, Duration delay) {
        events.tickCompleted(new TickEvent(name(), outcome, jobId, clock.now()));
        scheduleNext(epoch, delay);
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
