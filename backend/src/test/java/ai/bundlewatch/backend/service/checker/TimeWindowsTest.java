package ai.bundlewatch.backend.service.checker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowsTest {

    private static final Instant TRIGGER = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void deadline_ShouldBeTriggerPlusWindow() {
        assertEquals(Optional.of(Instant.parse("2024-03-01T11:00:00Z")), TimeWindows.deadline(TRIGGER, 1.0));
        assertEquals(Optional.of(Instant.parse("2024-03-01T10:30:00Z")), TimeWindows.deadline(TRIGGER, 0.5));
        assertEquals(Optional.of(Instant.parse("2024-03-04T10:00:00Z")), TimeWindows.deadline(TRIGGER, 72.0));
    }

    @Test
    void deadline_WhenNoWindow_ShouldBeAbsent() {
        assertTrue(TimeWindows.deadline(TRIGGER, null).isEmpty());
    }

    @Test
    void withinWindow_AtDeadline_ShouldStillBeOpen() {
        Instant deadline = TRIGGER.plus(Duration.ofHours(1));

        assertTrue(TimeWindows.withinWindow(deadline, TRIGGER, 1.0));
        assertFalse(TimeWindows.withinWindow(deadline.plusMillis(1), TRIGGER, 1.0));
    }

    @Test
    void withinWindow_WhenNoWindow_ShouldNeverExpire() {
        assertTrue(TimeWindows.withinWindow(TRIGGER.plus(Duration.ofDays(365)), TRIGGER, null));
    }

    @Test
    void onOrBefore_EvidenceAtDeadline_ShouldCount() {
        Instant deadline = TRIGGER.plus(Duration.ofHours(1));

        assertTrue(TimeWindows.onOrBefore(deadline, deadline));
        assertTrue(TimeWindows.onOrBefore(deadline.minusSeconds(1), deadline));
        assertFalse(TimeWindows.onOrBefore(deadline.plusSeconds(1), deadline));
    }

    @Test
    void onOrBefore_WithoutDeadline_ShouldAcceptAnyTimestampedEvidence() {
        assertTrue(TimeWindows.onOrBefore(TRIGGER.plus(Duration.ofDays(10)), null));
        assertFalse(TimeWindows.onOrBefore(null, null));
    }
}
