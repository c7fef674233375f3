package net.cronbeat.core.service;

import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * 처리 끝난 잡의 다음 startAt 계산. empty 면 더 이상 발생이 없다는 뜻 (1회성/만료/식 오류).
 */
public final class ScheduleCalculator {
    private static final Logger log = LoggerFactory.getLogger(ScheduleCalculator.class);

    private final CronCalculator cron;
    private final Clock clock;
    private final Duration nextDelay;
    private final ZoneId zone;

    public ScheduleCalculator(CronCalculator cron, Clock clock, Duration nextDelay, ZoneId zone) {
        this.cron = cron;
        this.clock = clock;
        this.nextDelay = nextDelay;
        this.zone = zone;
    }

    public Optional<Instant> nextStart(CronJob job) {
        CronState s = job.cron();
        if (!s.isRecurring()) return Optional.empty();

        Instant floor = clock.now().plus(nextDelay); // 이 시각 이전에는 다시 돌지 않는다
        if (s.startAt() != null && !s.startAt().isBefore(floor)) {
            return Optional.of(s.startAt()); // 아직 미래, 건드리지 않음
        }

        try {
            // floor 이상 첫 발생은 건너뛰고 그 다음 발생을 쓴다 (현재 틱과 겹치지 않게)
            Optional<Instant> first = cron.next(floor.minusNanos(1), s.interval(), zone)
                    .filter(t -> withinStop(t, s));
            if (first.isEmpty()) return Optional.empty();
            return cron.next(first.get(), s.interval(), zone)
                    .filter(t -> withinStop(t, s));
        } catch (RuntimeException e) {
            log.debug("cannot evaluate interval '{}' of job {}, retiring", s.interval(), job.id(), e);
            return Optional.empty();
        }
    }

    private static boolean withinStop(Instant t, CronState s) {
        return s.stopAt() == null || !t.isAfter(s.stopAt());
    }
}
