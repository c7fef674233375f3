package net.cronbeat.core.event;

import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.service.CronJobException;

import java.time.Instant;
import java.util.Optional;

public record JobErrorEvent(String scheduler, CronJobException error, Optional<CronJob> job, Instant at) {
}
