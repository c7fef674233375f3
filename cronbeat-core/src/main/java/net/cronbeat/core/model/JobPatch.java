package net.cronbeat.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 스케줄링 필드에 대한 부분 업데이트 (set / unset / processedCount 증가).
 * <p>같은 필드를 set 과 unset 에 동시에 둘 수 없다. 마지막 호출이 이긴다.
 */
public final class JobPatch {

    public enum Field { ENABLED, START_AT, STOP_AT, LOCKED, STARTED_AT, PROCESSED_AT, LAST_ERROR }

    private final Map<Field, Object> sets;
    private final Set<Field> unsets;
    private final boolean incrementProcessedCount;

    private JobPatch(Builder b) {
        this.sets = Collections.unmodifiableMap(new EnumMap<>(b.sets));
        this.unsets = Collections.unmodifiableSet(b.unsets.isEmpty() ? EnumSet.noneOf(Field.class) : EnumSet.copyOf(b.unsets));
        this.incrementProcessedCount = b.incrementProcessedCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<Field, Object> sets() {
        return sets;
    }

    public Set<Field> unsets() {
        return unsets;
    }

    public boolean incrementsProcessedCount() {
        return incrementProcessedCount;
    }

    public boolean isEmpty() {
        return sets.isEmpty() && unsets.isEmpty() && !incrementProcessedCount;
    }

    /** 메모리 상의 상태에 패치 적용 (인메모리 저장소/테스트용) */
    public CronState applyTo(CronState s) {
        Boolean enabled = s.enabled();
        Instant startAt = s.startAt();
        Instant stopAt = s.stopAt();
        boolean locked = s.locked();
        Instant startedAt = s.startedAt();
        Instant processedAt = s.processedAt();
        String lastError = s.lastError();

        for (var e : sets.entrySet()) {
            switch (e.getKey()) {
                case ENABLED -> enabled = (Boolean) e.getValue();
                case START_AT -> startAt = (Instant) e.getValue();
                case STOP_AT -> stopAt = (Instant) e.getValue();
                case LOCKED -> locked = (Boolean) e.getValue();
                case STARTED_AT -> startedAt = (Instant) e.getValue();
                case PROCESSED_AT -> processedAt = (Instant) e.getValue();
                case LAST_ERROR -> lastError = (String) e.getValue();
            }
        }
        for (Field f : unsets) {
            switch (f) {
                case ENABLED -> enabled = null;
                case START_AT -> startAt = null;
                case STOP_AT -> stopAt = null;
                case LOCKED -> locked = false;
                case STARTED_AT -> startedAt = null;
                case PROCESSED_AT -> processedAt = null;
                case LAST_ERROR -> lastError = null;
            }
        }
        long count = incrementProcessedCount ? s.processedCount() + 1 : s.processedCount();
        return new CronState(enabled, startAt, stopAt, s.interval(), s.removeExpired(),
                startedAt, processedAt, count, locked, lastError);
    }

    @Override
    public String toString() {
        return "JobPatch{sets=" + sets + ", unsets=" + unsets + ", incrementProcessedCount=" + incrementProcessedCount + '}';
    }

    public static final class Builder {
        private final Map<Field, Object> sets = new EnumMap<>(Field.class);
        private final Set<Field> unsets = EnumSet.noneOf(Field.class);
        private boolean incrementProcessedCount;

        private Builder() {}

        private Builder set(Field f, Object value) {
            Objects.requireNonNull(value, () -> f + " value must not be null, use unset");
            unsets.remove(f);
            sets.put(f, value);
            return this;
        }

        private Builder unset(Field f) {
            sets.remove(f);
            unsets.add(f);
            return this;
        }

        public Builder enabled(boolean enabled) { return set(Field.ENABLED, enabled); }
        public Builder disable() { return set(Field.ENABLED, Boolean.FALSE); }
        public Builder startAt(Instant at) { return set(Field.START_AT, at); }
        public Builder stopAt(Instant at) { return set(Field.STOP_AT, at); }
        public Builder clearStopAt() { return unset(Field.STOP_AT); }
        public Builder lock() { return set(Field.LOCKED, Boolean.TRUE); }
        public Builder unlock() { return unset(Field.LOCKED); }
        public Builder startedAt(Instant at) { return set(Field.STARTED_AT, at); }
        public Builder processedAt(Instant at) { return set(Field.PROCESSED_AT, at); }
        public Builder lastError(String message) { return set(Field.LAST_ERROR, message); }
        public Builder clearLastError() { return unset(Field.LAST_ERROR); }

        public Builder incrementProcessedCount() {
            this.incrementProcessedCount = true;
            return this;
        }

        public JobPatch build() {
            return new JobPatch(this);
        }
    }
}
