package net.cronbeat.core.model;

import java.time.Instant;

public record CronJob(
        Long id,
        String name,
        String kind,
        String payload,
        CronState cron,
        Instant createdAt,
        Instant updatedAt
) {
    public static CronJob ofNew(String name, String kind, String payload, CronState cron) {
        return new CronJob(null, name, kind, payload, cron, null, null);
    }

    public CronJob withCron(CronState cron) {
        return new CronJob(id, name, kind, payload, cron, createdAt, updatedAt);
    }

    public CronJob withId(Long id) {
        return new CronJob(id, name, kind, payload, cron, createdAt, updatedAt);
    }
}
