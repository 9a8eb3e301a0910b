package com.gt.recall.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.recall.model.SessionStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class SessionStatusSerializer extends JsonSerializer<SessionStatus> {
    @Override
    public void serialize(SessionStatus sessionStatus, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeNumber(sessionStatus.getSessionStatusId());
    }
}
