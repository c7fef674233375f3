package net.cronbeat.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * cron-utils 기반 발생 시각 계산기 (6필드: 초 분 시 일 월 요일, Guava 없이 LRU 캐시)
 */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    // 간단 LRU(최대 256개)
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /** after 보다 엄격히 뒤인 첫 발생 시각. 식이 잘못되면 IllegalArgumentException */
    public static Optional<Instant> next(String cronExpr, ZoneId zone, Instant after) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(after);

        // 식의 해상도는 초. 소수 초를 남기면 결과에도 그대로 붙어 나온다
        ZonedDateTime base = after.truncatedTo(ChronoUnit.SECONDS).atZone(zone);
        return executionTime(cronExpr).nextExecution(base).map(ZonedDateTime::toInstant);
    }

    /** 파싱 가능 여부. 파싱 결과는 캐시에 남는다 */
    public static void validate(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) throw new IllegalArgumentException("cron expression is blank");
        executionTime(cronExpr);
    }

    private static ExecutionTime executionTime(String cronExpr) {
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(cronExpr);
            if (cached != null) return cached;
            // 잘못된 식은 parse 에서 IllegalArgumentException, 캐시에 남지 않는다
            ExecutionTime et = ExecutionTime.forCron(PARSER.parse(cronExpr));
            CACHE.put(cronExpr, et);
            return et;
        }
    }

    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    static int cachedCount() { synchronized (CACHE) { return CACHE.size(); } }

    // --- 내부 LRU ---
    private static final class LruMap<K,V> extends LinkedHashMap<K,V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K,V> eldest) { return size() > max; }
    }
}
