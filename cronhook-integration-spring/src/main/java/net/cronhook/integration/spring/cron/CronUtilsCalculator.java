package net.cronhook.integration.spring.cron;

import net.cronhook.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

/** 코어 SPI 구현체 */
public final class CronUtilsCalculator implements CronCalculator {
    private final UnixCronPlanner planner;

    public CronUtilsCalculator() {
        this(new UnixCronPlanner(256));
    }

    public CronUtilsCalculator(UnixCronPlanner planner) {
        this.planner = planner;
    }

    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return planner.nextAfter(cronExpr, zone, from);
    }
}
