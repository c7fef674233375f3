package net.cronbeat.integration.spring.cron;

import net.cronbeat.core.spi.CronCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/** 코어 SPI 구현체 */
public final class CronUtilsCalculator implements CronCalculator {
    private static final Logger log = LoggerFactory.getLogger(CronUtilsCalculator.class);

    @Override
    public Optional<Instant> next(Instant after, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.next(cronExpr, zone, after);
    }

    @Override
    public boolean isValid(String cronExpr) {
        try {
            CronSlotPlanner.validate(cronExpr);
            return true;
        } catch (IllegalArgumentException e) {
            log.debug("rejected cron expression [{}]: {}", cronExpr, e.getMessage());
            return false;
        }
    }
}
