package net.cronhook.core.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;

public final class TimeZones {
    private static final Logger log = LoggerFactory.getLogger(TimeZones.class);

    public static final String DEFAULT_ZONE = "UTC";

    private TimeZones() {}

    /** 해석 가능한 이름이면 그대로, 아니면 UTC (경고 로그) */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            log.warn("Missing timezone, falling back to {}", DEFAULT_ZONE);
            return DEFAULT_ZONE;
        }
        try {
            ZoneId.of(name);
            return name;
        } catch (DateTimeException e) {
            log.warn("Invalid timezone {}, falling back to {}", name, DEFAULT_ZONE);
            return DEFAULT_ZONE;
        }
    }

    public static ZoneId resolve(String name) {
        return ZoneId.of(normalize(name));
    }

    /** 폴백 없이 해석. 빈 값만 UTC로 본다 */
    static ZoneId strict(String name) {
        return ZoneId.of(name == null || name.isBlank() ? DEFAULT_ZONE : name);
    }
}
