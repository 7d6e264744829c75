package net.cronhook.integration.spring;

import net.cronhook.core.schedule.NextRunCalculator;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.JobStore;
import net.cronhook.core.store.InMemoryJobStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;

@Configuration(proxyBeanMethods = false)
public class CronhookSpringConfig {

    @Bean public Clock systemClock() { return Instant::now; }

    // 잡 목록은 프로세스 메모리에만 둔다
    @Bean public JobStore jobStore(Clock clock) { return new InMemoryJobStore(clock); }

    @Bean public NextRunCalculator nextRunCalculator() { return new NextRunCalculator(); }
}
