package net.cronbeat.core.service;

import net.cronbeat.core.model.JobCriterion;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class CronSchedulerConfig {
    public static final Duration DEFAULT_IDLE_DELAY = Duration.ofSeconds(1);

    private final String name;
    private final CronJobHandler handler;
    private final Duration idleDelay;
    private final Duration nextDelay;
    private final Duration tickDelay;
    private final List<JobCriterion> addToQuery;
    private final ZoneId zone;

    private CronSchedulerConfig(Builder b) {
        this.name = b.name;
        this.handler = Objects.requireNonNull(b.handler, "handler is required");
        this.idleDelay = nonNegative(b.idleDelay, "idleDelay");
        this.nextDelay = nonNegative(b.nextDelay, "nextDelay");
        this.tickDelay = nonNegative(b.tickDelay, "tickDelay");
        this.addToQuery = List.copyOf(b.addToQuery);
        this.zone = b.zone;
    }

    private static Duration nonNegative(Duration d, String field) {
        Objects.requireNonNull(d, field);
        if (d.isNegative()) throw new IllegalArgumentException(field + " must not be negative: " + d);
        return d;
    }

    public static Builder builder(CronJobHandler handler) {
        return new Builder().handler(handler);
    }

    public String name() { return name; }
    public CronJobHandler handler() { return handler; }
    /** 선점할 잡이 없을 때 다음 하트비트까지 */
    public Duration idleDelay() { return idleDelay; }
    /** 같은 잡을 다시 선점할 수 있기까지의 최소 간격 */
    public Duration nextDelay() { return nextDelay; }
    /** 처리 완료 후 다음 잡을 찾기까지 */
    public Duration tickDelay() { return tickDelay; }
    public List<JobCriterion> addToQuery() { return addToQuery; }
    public ZoneId zone() { return zone; }

    @Override
    public String toString() {
        return "CronSchedulerConfig{" +
                "name='" + name + '\'' +
                ", idleDelay=" + idleDelay +
                ", nextDelay=" + nextDelay +
                ", tickDelay=" + tickDelay +
                ", addToQuery=" + addToQuery +
                ", zone=" + zone +
                '}';
    }

    public static final class Builder {
        private String name = "default";
        private CronJobHandler handler;
        private Duration idleDelay = DEFAULT_IDLE_DELAY;
        private Duration nextDelay = Duration.ZERO;
        private Duration tickDelay = Duration.ZERO;
        private final List<JobCriterion> addToQuery = new ArrayList<>();
        private ZoneId zone = ZoneOffset.UTC;

        private Builder() {}

        public Builder name(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
            this.name = name;
            return this;
        }

        public Builder handler(CronJobHandler handler) { this.handler = handler; return this; }
        public Builder idleDelay(Duration idleDelay) { this.idleDelay = idleDelay; return this; }
        public Builder nextDelay(Duration nextDelay) { this.nextDelay = nextDelay; return this; }
        public Builder tickDelay(Duration tickDelay) { this.tickDelay = tickDelay; return this; }
        public Builder zone(ZoneId zone) { this.zone = Objects.requireNonNull(zone, "zone"); return this; }

        public Builder addToQuery(JobCriterion criterion) {
            this.addToQuery.add(Objects.requireNonNull(criterion, "criterion"));
            return this;
        }

        public Builder addToQuery(List<JobCriterion> criteria) {
            criteria.forEach(this::addToQuery);
            return this;
        }

        public CronSchedulerConfig build() {
            return new CronSchedulerConfig(this);
        }
    }
}
