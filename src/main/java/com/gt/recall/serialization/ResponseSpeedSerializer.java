package com.gt.recall.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.recall.model.ResponseSpeed;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ResponseSpeedSerializer extends JsonSerializer<ResponseSpeed> {
    @Override
    public void serialize(ResponseSpeed responseSpeed, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeNumber(responseSpeed.getResponseSpeedId());
    }
}
