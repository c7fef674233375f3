package net.cronbeat.app;

import net.cronbeat.core.event.CronEventListener;
import net.cronbeat.core.event.JobErrorEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class CronbeatApplication {
    private static final Logger log = LoggerFactory.getLogger(CronbeatApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CronbeatApplication.class, args);
    }

    @Bean
    public CronEventListener jobErrorLogger() {
        return new CronEventListener() {
            @Override
            public void onJobError(JobErrorEvent e) {
                log.warn("job error on '{}' ({}): {}", e.scheduler(),
                        e.job().map(j -> j.name()).orElse("no job"), e.error().getMessage());
            }
        };
    }
}
