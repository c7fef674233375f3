package net.cronbeat.bootstrap.catalog;

import net.cronbeat.bootstrap.props.CronbeatProperties;
import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.model.CronState;
import net.cronbeat.core.spi.CronJobRepository;
import net.cronbeat.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 설정에 선언된 잡을 name 기준으로 멱등 등록한다. 재기동 시 런타임 상태(다음 실행 시각, 잠금, 횟수)는 유지된다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final CronJobRepository jobs;
    private final TxRunner tx;
    private final ZoneId zone;

    public CatalogRegistrar(CronJobRepository jobs, TxRunner tx, ZoneId zone) {
        this.jobs = jobs;
        this.tx = tx;
        this.zone = zone;
    }

    public List<CronJob> register(CronbeatProperties.Catalog catalog) throws Exception {
        log.info("catalog: {} job(s) declared", catalog.getJobs().size());
        List<CronJob> out = new ArrayList<>();
        for (var def : catalog.getJobs()) {
            out.add(upsert(def));
        }
        return out;
    }

    private CronJob upsert(CronbeatProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getName().isBlank()) {
            throw new IllegalArgumentException("job.name is required: " + def);
        }

        String interval = def.getInterval() == null || def.getInterval().isBlank() ? null : def.getInterval();
        var state = new CronState(
                def.getEnabled(),
                parseInstant(def.getStartAt(), "start-at"),
                parseInstant(def.getStopAt(), "stop-at"),
                interval,
                def.isRemoveExpired(),
                null, null, 0L, false, null
        );

        var job = tx.required(() -> jobs.upsert(def.getName(), def.getKind(), def.getPayload(), state));
        log.info("Catalog registered: job='{}' kind={} interval={} startAt={}",
                job.name(), job.kind(), job.cron().interval(), job.cron().startAt());
        return job;
    }

    private Instant parseInstant(String value, String field) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException withoutOffset) {
            try {
                return LocalDateTime.parse(value).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                e.addSuppressed(withoutOffset);
                throw new IllegalArgumentException("invalid " + field + ": " + value, e);
            }
        }
    }
}
