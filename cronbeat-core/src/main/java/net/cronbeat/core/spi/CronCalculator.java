package net.cronbeat.core.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * 6필드(초 분 시 일 월 요일) cron 식 해석기.
 */
public interface CronCalculator {
    /** after 보다 엄격히 뒤인 첫 발생 시각. 발생이 없으면 empty, 식이 잘못되면 IllegalArgumentException */
    Optional<Instant> next(Instant after, String cronExpr, ZoneId zone);

    boolean isValid(String cronExpr);
}
