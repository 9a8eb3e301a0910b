package com.gt.recall.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.recall.serialization.ResponseSpeedSerializer;

@JsonSerialize(using = ResponseSpeedSerializer.class, as = Integer.class)
public enum ResponseSpeed {
    Fast(0),
    Normal(1),
    Slow(2);

    private int responseSpeedId;

    ResponseSpeed(int responseSpeedId) {
        this.responseSpeedId = responseSpeedId;
    }

    public int getResponseSpeedId() {
        return responseSpeedId;
    }

    @JsonCreator
    public static ResponseSpeed fromId(int id) {
        for (ResponseSpeed responseSpeed : values()) {
            if (responseSpeed.responseSpeedId == id) {
                return responseSpeed;
            }
        }

        return null;
    }
}
