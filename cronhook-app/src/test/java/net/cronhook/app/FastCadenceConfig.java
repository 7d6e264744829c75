package net.cronhook.app;

import net.cronhook.core.spi.CronCalculator;
import net.cronhook.integration.spring.cron.CronUtilsCalculator;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Instant;
import java.time.ZoneId;

/** 표현식 검증은 실제 cron 으로 하고, 발화 간격만 300ms 로 줄인다 */
@TestConfiguration(proxyBeanMethods = false)
class FastCadenceConfig {

    @Bean
    CronCalculator cronCalculator() {
        CronUtilsCalculator real = new CronUtilsCalculator();
        return new CronCalculator() {
            @Override
            public Instant next(Instant from, String cronExpr, ZoneId zone) {
                if (!real.isValid(cronExpr)) throw new IllegalArgumentException("Invalid cron: " + cronExpr);
                return from.plusMillis(300);
            }

            @Override
            public boolean isValid(String cronExpr) {
                return real.isValid(cronExpr);
            }
        };
    }
}
