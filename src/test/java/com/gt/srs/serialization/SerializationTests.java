package com.gt.srs.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gt.srs.model.Grade;
import com.gt.srs.model.ProgressStatus;
import com.gt.srs.review.model.GradeResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(SpringExtension.class)
public class SerializationTests {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    public void testGradeSerialization() throws Exception {
        assertEquals("3", objectMapper.writeValueAsString(Grade.Good));
        assertEquals(Grade.Easy, objectMapper.readValue("4", Grade.class));
    }

    @Test
    public void testProgressStatusSerialization() throws Exception {
        assertEquals("\"reviewing\"", objectMapper.writeValueAsString(ProgressStatus.Reviewing));
    }

    @Test
    public void testGradeResultSerialization() throws Exception {
        GradeResult gradeResult = new GradeResult(Instant.parse("2024-03-03T12:00:00Z"), 1.5, 4.8, ProgressStatus.Reviewing);

        Map<?, ?> json = objectMapper.readValue(objectMapper.writeValueAsString(gradeResult), Map.class);

        assertEquals(1.5, json.get("stability"));
        assertEquals(4.8, json.get("difficulty"));
        assertEquals("reviewing", json.get("status"));
    }
}
