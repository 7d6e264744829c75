package net.cronhook.core.schedule;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class TimeZonesTest {

    @Test
    void valid_zone_is_kept() {
        assertEquals("Asia/Seoul", TimeZones.normalize("Asia/Seoul"));
        assertEquals(ZoneId.of("Europe/Berlin"), TimeZones.resolve("Europe/Berlin"));
    }

    @Test
    void missing_or_unknown_zone_becomes_utc() {
        assertEquals("UTC", TimeZones.normalize(null));
        assertEquals("UTC", TimeZones.normalize("  "));
        assertEquals("UTC", TimeZones.normalize("Mars/Olympus"));
        assertEquals(ZoneId.of("UTC"), TimeZones.resolve("not a zone"));
    }
}
