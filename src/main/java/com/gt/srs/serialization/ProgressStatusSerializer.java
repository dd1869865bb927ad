package com.gt.srs.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.srs.model.ProgressStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ProgressStatusSerializer extends JsonSerializer<ProgressStatus> {
    @Override
    public void serialize(ProgressStatus status, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(status.getStatusValue());
    }
}
