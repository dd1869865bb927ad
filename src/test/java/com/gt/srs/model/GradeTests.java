package com.gt.srs.model;

import com.gt.srs.exception.InvalidGradeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class GradeTests {

    @Test
    public void testFromGradeValue() {
        assertEquals(Grade.Again, Grade.fromGradeValue(1));
        assertEquals(Grade.Hard, Grade.fromGradeValue(2));
        assertEquals(Grade.Good, Grade.fromGradeValue(3));
        assertEquals(Grade.Easy, Grade.fromGradeValue(4));

        assertThrows(InvalidGradeException.class, () -> Grade.fromGradeValue(0));
        assertThrows(InvalidGradeException.class, () -> Grade.fromGradeValue(5));
        assertThrows(InvalidGradeException.class, () -> Grade.fromGradeValue(-1));
    }

    @Test
    public void testFromScore_fraction() {
        assertEquals(Grade.Again, Grade.fromScore(0));
        assertEquals(Grade.Again, Grade.fromScore(0.39));
        assertEquals(Grade.Hard, Grade.fromScore(0.4));
        assertEquals(Grade.Good, Grade.fromScore(0.6));
        assertEquals(Grade.Easy, Grade.fromScore(0.85));
        assertEquals(Grade.Easy, Grade.fromScore(1.0));
    }

    @Test
    public void testFromScore_percentage() {
        assertEquals(Grade.Again, Grade.fromScore(25));
        assertEquals(Grade.Hard, Grade.fromScore(55));
        assertEquals(Grade.Good, Grade.fromScore(84));
        assertEquals(Grade.Easy, Grade.fromScore(100));
    }

    @Test
    public void testFromScore_invalid() {
        assertThrows(InvalidGradeException.class, () -> Grade.fromScore(-0.1));
        assertThrows(InvalidGradeException.class, () -> Grade.fromScore(101));
        assertThrows(InvalidGradeException.class, () -> Grade.fromScore(Double.NaN));
    }

    @Test
    public void testLapseAndStruggle() {
        assertTrue(Grade.Again.isLapse());
        assertFalse(Grade.Hard.isLapse());

        assertTrue(Grade.Again.isStruggle());
        assertTrue(Grade.Hard.isStruggle());
        assertFalse(Grade.Good.isStruggle());
        assertFalse(Grade.Easy.isStruggle());
    }
}
