package net.cronbeat.integration.spring;

import net.cronbeat.adapter.jdbc.repo.JdbcCronJobRepository;
import net.cronbeat.core.spi.Clock;
import net.cronbeat.core.spi.CronCalculator;
import net.cronbeat.core.spi.CronJobRepository;
import net.cronbeat.core.spi.TxRunner;
import net.cronbeat.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * JDBC 저장소 배선 (adapter-jdbc 재사용). Clock/CronCalculator 는 앱이나 오토컨피그가 제공한다.
 */
@Configuration(proxyBeanMethods = false)
public class CronbeatSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public CronJobRepository cronJobRepository(Clock clock, CronCalculator cron) {
        return new JdbcCronJobRepository(clock, cron);
    }
}
