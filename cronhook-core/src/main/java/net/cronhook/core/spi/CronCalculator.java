package net.cronhook.core.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** 실제 발화 시각(cadence) 계산 */
public interface CronCalculator {
    /** from 이후(초과) 첫 발화 시각. 해석 불가 표현식이면 IllegalArgumentException */
    Instant next(Instant from, String cronExpr, ZoneId zone);

    default boolean isValid(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) return false;
        try {
            next(Instant.EPOCH, cronExpr, ZoneOffset.UTC);
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
