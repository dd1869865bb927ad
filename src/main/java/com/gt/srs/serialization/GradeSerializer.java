package com.gt.srs.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.srs.model.Grade;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class GradeSerializer extends JsonSerializer<Grade> {
    @Override
    public void serialize(Grade grade, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeNumber(grade.getGradeValue());
    }
}
