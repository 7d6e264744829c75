package net.cronhook.core.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * 잡에 기록되는 nextRun 계산기.
 *
 * <p>분/시 필드만 반영한다. 일/월/요일 필드는 문법상 받기만 하고 계산에는 쓰지 않는다.
 * 실제 타이머 발화 시각은 {@link net.cronhook.core.spi.CronCalculator} 가 정한다.
 *
 * <p>계산은 아래 단계를 순서대로 시도하고, 실패한 단계는 로그를 남긴 뒤 다음 단계로 넘어간다.
 * <ol>
 *     <li>필드 연산 (요청 타임존 기준)</li>
 *     <li>요청 타임존 기준 now + 1분</li>
 *     <li>UTC 기준 now + 1분 (실패하지 않음)</li>
 * </ol>
 */
public final class NextRunCalculator {
    private static final Logger log = LoggerFactory.getLogger(NextRunCalculator.class);

    private static final String WILDCARD = "*";
    private static final String STEP_PREFIX = "*/";
    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);

    @FunctionalInterface
    private interface Attempt {
        Instant compute(String[] fields, String timeZone, Instant now);
    }

    private record Step(String name, Attempt attempt) {}

    private final List<Step> steps = List.of(
            new Step("cron field arithmetic", NextRunCalculator::fromFields),
            new Step("one minute in requested zone", (fields, timeZone, now) ->
                    now.atZone(TimeZones.strict(timeZone)).plus(ONE_MINUTE).toInstant())
    );

    /** 5필드가 아니면 empty */
    public Optional<Instant> computeNextRun(String schedule, String timeZone, Instant now) {
        String[] fields = schedule == null ? new String[0] : schedule.trim().split("\\s+");
        if (fields.length != 5) {
            log.error("Invalid CRON expression: {}", schedule);
            return Optional.empty();
        }

        for (Step step : steps) {
            try {
                return Optional.of(step.attempt().compute(fields, timeZone, now));
            } catch (RuntimeException e) {
                log.warn("Next run step '{}' failed for [{}] in {}: {}", step.name(), schedule, timeZone, e.toString());
            }
        }
        log.warn("Falling back to one minute from now in UTC for [{}]", schedule);
        return Optional.of(now.plus(ONE_MINUTE));
    }

    private static Instant fromFields(String[] fields, String timeZone, Instant now) {
        ZoneId zone = TimeZones.strict(timeZone);
        ZonedDateTime current = now.atZone(zone);
        String minute = fields[0];
        String hour = fields[1];

        if (isAllWildcard(fields)) {
            return current.truncatedTo(ChronoUnit.MINUTES).plus(ONE_MINUTE).toInstant();
        }

        // 분 스텝은 시 필드를 보지 않고 바로 확정
        if (minute.startsWith(STEP_PREFIX)) {
            int interval = parseStep(minute);
            int nextMinute = (current.getMinute() / interval + 1) * interval;
            return current.truncatedTo(ChronoUnit.HOURS).plusMinutes(nextMinute).toInstant();
        }

        Integer fixedMinute = null;
        ZonedDateTime next;
        if (WILDCARD.equals(minute)) {
            next = current.truncatedTo(ChronoUnit.MINUTES).plus(ONE_MINUTE);
        } else {
            fixedMinute = parseValue(minute, 59);
            ZonedDateTime inThisHour = current.truncatedTo(ChronoUnit.HOURS).plusMinutes(fixedMinute);
            next = fixedMinute > current.getMinute() ? inThisHour : inThisHour.plusHours(1);
        }

        if (WILDCARD.equals(hour)) {
            return next.toInstant();
        }

        // 분이 와일드카드면 대상 시간의 0분. 현재 분(초 포함)을 끌고 가지 않는다
        int minuteOfHour = fixedMinute != null ? fixedMinute : 0;

        if (hour.startsWith(STEP_PREFIX)) {
            int interval = parseStep(hour);
            int nextHour = (current.getHour() / interval + 1) * interval;
            LocalDate day = current.toLocalDate().plusDays(nextHour / 24);
            return ZonedDateTime.of(day, LocalTime.of(nextHour % 24, minuteOfHour), zone).toInstant();
        }

        int targetHour = parseValue(hour, 23);
        if (fixedMinute == null && targetHour == current.getHour() && next.getHour() == targetHour) {
            return next.toInstant(); // 아직 대상 시간대 안
        }
        ZonedDateTime candidate = ZonedDateTime.of(current.toLocalDate(), LocalTime.of(targetHour, minuteOfHour), zone);
        return (candidate.isAfter(current) ? candidate : candidate.plusDays(1)).toInstant();
    }

    private static boolean isAllWildcard(String[] fields) {
        for (String f : fields) {
            if (!WILDCARD.equals(f)) return false;
        }
        return true;
    }

    private static int parseStep(String field) {
        int interval = leadingInt(field.substring(STEP_PREFIX.length()), field);
        if (interval <= 0) throw new IllegalArgumentException("Step must be positive: " + field);
        return interval;
    }

    private static int parseValue(String field, int max) {
        int value = leadingInt(field, field);
        if (value > max) throw new IllegalArgumentException("Value out of range 0-" + max + ": " + field);
        return value;
    }

    /** 선행 숫자만 읽는다 ("0,30" -> 0, "5-10" -> 5) */
    private static int leadingInt(String s, String field) {
        int end = 0;
        while (end < s.length() && Character.isDigit(s.charAt(end))) end++;
        if (end == 0) throw new IllegalArgumentException("Unsupported cron field: " + field);
        return Integer.parseInt(s.substring(0, end));
    }
}
