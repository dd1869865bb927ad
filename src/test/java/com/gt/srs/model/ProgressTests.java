package com.gt.srs.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class ProgressTests {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    public void testInvalidProgress() {
        assertThrows(IllegalArgumentException.class, () -> buildProgress(0, 5, 1, 0, ProgressStatus.Reviewing));
        assertThrows(IllegalArgumentException.class, () -> buildProgress(-1, 5, 1, 0, ProgressStatus.Reviewing));
        assertThrows(IllegalArgumentException.class, () -> buildProgress(Double.NaN, 5, 1, 0, ProgressStatus.Reviewing));
        assertThrows(IllegalArgumentException.class, () -> buildProgress(Double.POSITIVE_INFINITY, 5, 1, 0, ProgressStatus.Reviewing));
        assertThrows(IllegalArgumentException.class, () -> buildProgress(1, 0.99, 1, 0, ProgressStatus.Reviewing));
        assertThrows(IllegalArgumentException.class, () -> buildProgress(1, 10.01, 1, 0, ProgressStatus.Reviewing));
        assertThrows(IllegalArgumentException.class, () -> buildProgress(1, 5, -1, 0, ProgressStatus.Reviewing));
        assertThrows(IllegalArgumentException.class, () -> buildProgress(1, 5, 1, -1, ProgressStatus.Reviewing));
        assertThrows(IllegalArgumentException.class, () -> buildProgress(1, 5, 1, 0, null));
    }

    @Test
    public void testBoundaryDifficulty() {
        assertEquals(1.0, buildProgress(1, 1.0, 1, 0, ProgressStatus.Reviewing).difficulty());
        assertEquals(10.0, buildProgress(1, 10.0, 1, 0, ProgressStatus.Reviewing).difficulty());
    }

    @Test
    public void testIsDue() {
        Progress progress = buildProgress(2, 5, 1, 0, ProgressStatus.Reviewing);

        assertFalse(progress.isDue(NOW));
        assertTrue(progress.isDue(progress.nextDueAt()));
        assertTrue(progress.isDue(progress.nextDueAt().plusSeconds(1)));
    }

    @Test
    public void testStatusOrder() {
        assertTrue(ProgressStatus.New.isBefore(ProgressStatus.Learning));
        assertTrue(ProgressStatus.Learning.isBefore(ProgressStatus.Reviewing));
        assertTrue(ProgressStatus.Reviewing.isBefore(ProgressStatus.Mastered));
        assertFalse(ProgressStatus.Mastered.isBefore(ProgressStatus.Reviewing));
        assertEquals(ProgressStatus.Mastered, ProgressStatus.fromStatusValue("mastered"));
        assertThrows(IllegalArgumentException.class, () -> ProgressStatus.fromStatusValue("graduated"));
    }

    @Test
    public void testKey() {
        Progress progress = buildProgress(2, 5, 1, 0, ProgressStatus.Reviewing);

        assertEquals(new ProgressKey(1, 7), progress.key());
        assertEquals("learner 1/card 7", progress.key().toString());
    }

    private static Progress buildProgress(double stability, double difficulty, int repetitions, int lapses, ProgressStatus status) {
        return new Progress(1, 7, stability, difficulty, NOW, NOW.plusSeconds(86400), repetitions, lapses, status, 1, null);
    }
}
