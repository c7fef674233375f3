package net.cronbeat.core.event;

import java.time.Instant;

public record TickEvent(String scheduler, Outcome outcome, Long jobId, Instant at) {

    public enum Outcome { IDLE, PROCESSED, FAILED }
}
