package net.cronbeat.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 잡 레코드에 붙는 스케줄링 서브 구조.
 * <p>enabled/startAt/stopAt/interval/removeExpired 는 잡 소유자가, 나머지는 스케줄러가 채운다.
 */
public record CronState(
        Boolean enabled,
        Instant startAt,
        Instant stopAt,
        String interval,
        boolean removeExpired,
        Instant startedAt,
        Instant processedAt,
        long processedCount,
        boolean locked,
        String lastError
) {
    /** interval 반복 잡 */
    public static CronState recurring(String interval, Instant startAt) {
        return new CronState(true, startAt, null, interval, false, null, null, 0L, false, null);
    }

    /** interval 없는 1회성 잡 (startAt null 이면 저장 시각) */
    public static CronState oneShot(Instant startAt) {
        return new CronState(true, startAt, null, null, false, null, null, 0L, false, null);
    }

    public CronState withStopAt(Instant stopAt) {
        return new CronState(enabled, startAt, stopAt, interval, removeExpired,
                startedAt, processedAt, processedCount, locked, lastError);
    }

    public CronState withRemoveExpired(boolean removeExpired) {
        return new CronState(enabled, startAt, stopAt, interval, removeExpired,
                startedAt, processedAt, processedCount, locked, lastError);
    }

    public CronState withEnabled(Boolean enabled) {
        return new CronState(enabled, startAt, stopAt, interval, removeExpired,
                startedAt, processedAt, processedCount, locked, lastError);
    }

    public CronState withLocked(boolean locked) {
        return new CronState(enabled, startAt, stopAt, interval, removeExpired,
                startedAt, processedAt, processedCount, locked, lastError);
    }

    /** 최초 저장 시 기본값: enabled=true, startAt=now */
    public CronState withDefaults(Instant now) {
        return new CronState(enabled == null ? Boolean.TRUE : enabled,
                startAt == null ? now : startAt,
                stopAt, interval, removeExpired, startedAt, processedAt, processedCount, locked, lastError);
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean isRecurring() {
        return interval != null && !interval.isBlank();
    }

    /** 선점 가능 조건: enabled, 미잠금, startAt <= now, (stopAt 없음 or stopAt >= now) */
    public boolean isEligibleAt(Instant now) {
        if (!isEnabled() || locked) return false;
        if (startAt != null && startAt.isAfter(now)) return false;
        return stopAt == null || !stopAt.isBefore(now);
    }

    /** 처리 중 여부: 시작 기록은 있는데 그 이후 완료 기록이 없음 */
    public boolean processing() {
        if (startedAt == null) return false;
        return processedAt == null || processedAt.isBefore(startedAt);
    }

    public Optional<Duration> processDuration() {
        if (startedAt == null || processedAt == null || processedAt.isBefore(startedAt)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, processedAt));
    }
}
