package net.cronhook.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** cron-utils 기반 5필드(UNIX) 발화 시각 계산. 파싱 결과는 LRU 캐시 */
public final class UnixCronPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final Map<String, ExecutionTime> cache;

    public UnixCronPlanner(int cacheSize) {
        this.cache = new LruMap<>(cacheSize);
    }

    /** 해석 불가 표현식이면 IllegalArgumentException */
    public Instant nextAfter(String cronExpr, ZoneId zone, Instant from) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(from);

        ExecutionTime et = executionTime(cronExpr.trim());
        ZonedDateTime base = from.atZone(zone);
        return et.nextExecution(base)
                .orElseThrow(() -> new IllegalArgumentException("No next execution for [" + cronExpr + "] after " + base))
                .toInstant();
    }

    private ExecutionTime executionTime(String expr) {
        synchronized (cache) {
            ExecutionTime et = cache.get(expr);
            if (et == null) {
                et = ExecutionTime.forCron(PARSER.parse(expr)); // 실패 시 캐시에 남기지 않음
                cache.put(expr, et);
            }
            return et;
        }
    }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
