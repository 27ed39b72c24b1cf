package com.jobhist.config;

import com.jobhist.config.testing.ControllableClock;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class ClockProviderTest {

    @Test
    void todayFollowsClockZone() {
        Instant instant = Instant.parse("2025-03-01T03:00:00Z");

        assertEquals(LocalDate.of(2025, 3, 1), ClockProvider.fixed(instant, ZoneId.of("UTC")).today());
        assertEquals(LocalDate.of(2025, 2, 28),
                ClockProvider.fixed(instant, ZoneId.of("America/Denver")).today());
    }

    @Test
    void controllableClockAdvancesToday() {
        ControllableClock clock = ControllableClock.atStartOfDay(LocalDate.of(2025, 2, 27), ZoneId.of("UTC"));
        ClockProvider provider = new ClockProvider(clock);

        assertEquals(LocalDate.of(2025, 2, 27), provider.today());
        clock.advanceDays(2);
        assertEquals(LocalDate.of(2025, 3, 1), provider.today());
    }

    @Test
    void zoneFromConfig() {
        ClockProvider provider = ClockProvider.fromConfig(
                ConfigFactory.parseString("time-zone = \"Asia/Tokyo\""));

        assertEquals(ZoneId.of("Asia/Tokyo"), provider.getZone());
    }

    @Test
    void systemZoneKeyword() {
        assertEquals(ZoneId.systemDefault(), ClockProvider.parseZone("system"));
        assertEquals(ZoneId.systemDefault(), ClockProvider.parseZone(null));
        assertEquals(ZoneId.of("UTC"), ClockProvider.parseZone("UTC"));
    }

    @Test
    void nullClockRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ClockProvider(null));
    }
}
