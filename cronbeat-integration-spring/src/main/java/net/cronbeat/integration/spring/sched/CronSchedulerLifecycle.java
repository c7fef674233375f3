package net.cronbeat.integration.spring.sched;

import net.cronbeat.core.service.CronScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * 애플리케이션 컨텍스트 기동/종료에 맞춰 하트비트 루프를 켜고 끈다.
 * 카탈로그 등록(ApplicationRunner)보다 늦게 도는 게 자연스럽지만, 먼저 돌아도 다음 idle 틱에 잡힌다.
 */
public class CronSchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CronSchedulerLifecycle.class);

    private final CronScheduler scheduler;
    private Duration initialDelay = Duration.ZERO;
    private boolean autoStartup = true;

    public CronSchedulerLifecycle(CronScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        log.info("starting cron scheduler '{}' (initialDelay={})", scheduler.name(), initialDelay);
        scheduler.start(initialDelay);
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public CronScheduler getScheduler() {
        return scheduler;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }
}
