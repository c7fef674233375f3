package net.cronbeat.app;

import net.cronbeat.core.model.CronJob;
import net.cronbeat.core.service.CronJobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** 처리한 잡 이름을 로그로 남기는 예제 핸들러 */
@Component
public class ReminderHandler implements CronJobHandler {
    private static final Logger log = LoggerFactory.getLogger(ReminderHandler.class);

    private final Map<String, AtomicLong> processed = new ConcurrentHashMap<>();

    @Override
    public CompletionStage<?> handle(CronJob job) {
        log.info("processing {} (kind={}, payload={})", job.name(), job.kind(), job.payload());
        processed.computeIfAbsent(job.name(), k -> new AtomicLong()).incrementAndGet();
        return CompletableFuture.completedFuture(null);
    }

    public long processed(String name) {
        AtomicLong n = processed.get(name);
        return n == null ? 0 : n.get();
    }
}
