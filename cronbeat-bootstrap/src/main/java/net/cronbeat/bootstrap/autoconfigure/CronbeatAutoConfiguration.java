package net.cronbeat.bootstrap.autoconfigure;

import net.cronbeat.bootstrap.catalog.CatalogRegistrar;
import net.cronbeat.bootstrap.props.CronbeatProperties;
import net.cronbeat.core.event.CronEventListener;
import net.cronbeat.core.maintenance.MaintenanceService;
import net.cronbeat.core.memory.InMemoryCronJobRepository;
import net.cronbeat.core.model.JobCriterion;
import net.cronbeat.core.service.CronJobHandler;
import net.cronbeat.core.service.CronScheduler;
import net.cronbeat.core.service.CronSchedulerConfig;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronCalculator;
import net.cronbeat.core.spi.CronJobRepository;
import net.cronbeat.core.spi.TxRunner;
import net.cronbeat.integration.spring.CronbeatSpringConfig;
import net.cronbeat.integration.spring.cron.CronUtilsCalculator;
import net.cronbeat.integration.spring.sched.CronSchedulerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class
})
@EnableConfigurationProperties(CronbeatProperties.class)
public class CronbeatAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CronbeatAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public Clock cronbeatClock() {
        return Clock.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    // --- 저장소 선택 (cronbeat.store) ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "cronbeat", name = "store", havingValue = "jdbc", matchIfMissing = true)
    @Import(CronbeatSpringConfig.class) // integration-spring: repo/tx wiring
    static class JdbcStoreConfiguration {
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "cronbeat", name = "store", havingValue = "memory")
    static class MemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public TxRunner txRunner() {
            return TxRunner.direct();
        }

        @Bean
        @ConditionalOnMissingBean
        public CronJobRepository cronJobRepository(Clock clock, CronCalculator cron) {
            return new InMemoryCronJobRepository(clock, cron);
        }
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(CronJobRepository jobs, TxRunner tx, Clock clock) {
        return new MaintenanceService(jobs, tx, clock);
    }

    /** 핸들러 빈이 있을 때만 루프를 만든다 */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CronJobHandler.class)
    @ConditionalOnProperty(prefix = "cronbeat.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CronScheduler cronScheduler(CronJobHandler handler,
                                       CronJobRepository jobs,
                                       TxRunner tx,
                                       Clock clock,
                                       CronCalculator cron,
                                       CronbeatProperties props,
                                       ObjectProvider<CronEventListener> listeners) {
        var s = props.getScheduler();
        var cfg = CronSchedulerConfig.builder(handler)
                .name(s.getName())
                .idleDelay(s.getIdleDelay())
                .nextDelay(s.getNextDelay())
                .tickDelay(s.getTickDelay())
                .zone(ZoneId.of(props.getZone()));
        if (!s.getKinds().isEmpty()) {
            cfg.addToQuery(JobCriterion.kindIn(s.getKinds()));
        }

        var scheduler = new CronScheduler(cfg.build(), jobs, tx, clock, cron);
        listeners.orderedStream().forEach(scheduler.events()::subscribe);
        log.info("cron scheduler configured: {} (store={})", scheduler.config(), props.getStore());
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CronScheduler.class)
    public CronSchedulerLifecycle cronSchedulerLifecycle(CronScheduler scheduler, CronbeatProperties props) {
        var lifecycle = new CronSchedulerLifecycle(scheduler);
        lifecycle.setInitialDelay(props.getScheduler().getInitialDelay());
        return lifecycle;
    }

    @Bean
    @ConditionalOnMissingBean
    public CatalogRegistrar catalogRegistrar(CronJobRepository jobs, TxRunner tx, CronbeatProperties props) {
        return new CatalogRegistrar(jobs, tx, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronbeat.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner cronbeatCatalogRunner(CatalogRegistrar registrar, CronbeatProperties props) {
        return args -> registrar.register(props.getCatalog());
    }
}
