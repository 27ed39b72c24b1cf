package com.jobhist.stream.window;

import com.jobhist.config.ClockProvider;
import com.jobhist.config.testing.ControllableClock;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WindowResolver} and {@link DateWindow}.
 */
class WindowResolverTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    private final ControllableClock clock = ControllableClock.atStartOfDay(TODAY, ZoneOffset.UTC);
    private final WindowResolver resolver = new WindowResolver(new ClockProvider(clock));

    @Test
    void testDaysBackFromAnchor() {
        DateWindow window = resolver.resolve(LocalDate.of(2025, 3, 1), 4);

        assertEquals(LocalDate.of(2025, 2, 25), window.start());
        assertEquals(LocalDate.of(2025, 3, 1), window.end());
        assertEquals(5, window.length());
    }

    @Test
    void testZeroAndOneDaysBack() {
        LocalDate anchor = LocalDate.of(2025, 3, 1);

        assertEquals(new DateWindow(anchor, anchor, ReadDirection.FORWARD), resolver.resolve(anchor, 0));
        assertEquals(new DateWindow(LocalDate.of(2025, 2, 28), anchor, ReadDirection.FORWARD),
                resolver.resolve(anchor, 1));
    }

    @Test
    void testAcrossYearBoundary() {
        DateWindow window = resolver.resolve(LocalDate.of(2025, 1, 2), 3);

        assertEquals(LocalDate.of(2024, 12, 30), window.start());
    }

    @Test
    void testDefaultsToToday() {
        DateWindow window = resolver.resolve(WindowIntent.today());

        assertEquals(DateWindow.of(TODAY), window);

        DateWindow week = resolver.resolve(WindowIntent.builder().daysBack(6).build());
        assertEquals(LocalDate.of(2025, 3, 4), week.start());
        assertEquals(TODAY, week.end());
    }

    @Test
    void testExplicitRangeUsedAsIs() {
        WindowIntent intent = WindowIntent.builder()
                .range(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 2, 3))
                .anchor(LocalDate.of(2024, 1, 1))
                .daysBack(30)
                .direction(ReadDirection.REVERSE)
                .build();

        DateWindow window = resolver.resolve(intent);

        assertEquals(LocalDate.of(2025, 2, 1), window.start());
        assertEquals(LocalDate.of(2025, 2, 3), window.end());
        assertEquals(List.of(LocalDate.of(2025, 2, 3), LocalDate.of(2025, 2, 2), LocalDate.of(2025, 2, 1)),
                window.days());
    }

    @Test
    void testRangeStartAfterEndRejected() {
        WindowIntent intent = WindowIntent.builder()
                .range(LocalDate.of(2025, 3, 2), LocalDate.of(2025, 3, 1))
                .build();

        assertThrows(InvalidWindowException.class, () -> resolver.resolve(intent));
    }

    @Test
    void testNegativeDaysRejected() {
        assertThrows(InvalidWindowException.class, () -> resolver.resolve(LocalDate.of(2025, 3, 1), -1));
    }

    @Test
    void testFutureEndRejected() {
        assertThrows(InvalidWindowException.class, () -> resolver.resolve(TODAY.plusDays(1), 3));
        assertThrows(InvalidWindowException.class, () -> resolver.resolve(WindowIntent.builder()
                .range(TODAY.minusDays(2), TODAY.plusDays(1)).build()));
        assertDoesNotThrow(() -> resolver.resolve(TODAY, 0));
    }

    @Test
    void testTodayCapturedAtConstruction() {
        clock.advanceDays(5);

        assertEquals(TODAY, resolver.getToday());
        assertThrows(InvalidWindowException.class, () -> resolver.resolve(TODAY.plusDays(1), 0));
        assertEquals(TODAY.plusDays(5), new WindowResolver(new ClockProvider(clock)).getToday());
    }

    @Test
    void testWindowDaysForward() {
        DateWindow window = new DateWindow(LocalDate.of(2025, 2, 27), LocalDate.of(2025, 3, 1), ReadDirection.FORWARD);

        assertEquals(List.of(LocalDate.of(2025, 2, 27), LocalDate.of(2025, 2, 28), LocalDate.of(2025, 3, 1)),
                window.days());
        assertTrue(window.contains(LocalDate.of(2025, 2, 28)));
        assertFalse(window.contains(LocalDate.of(2025, 3, 2)));
        assertEquals(ReadDirection.REVERSE, window.withDirection(ReadDirection.REVERSE).direction());
    }
}
