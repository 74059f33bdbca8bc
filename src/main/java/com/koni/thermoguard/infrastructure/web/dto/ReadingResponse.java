package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.domain.model.Reading;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
@AllArgsConstructor
public class ReadingResponse {

    private final UUID readingId;
    private final UUID sensorId;
    private final Double temperature;
    private final Double humidity;
    private final Instant timestamp;

    public static ReadingResponse from(Reading reading) {
        return new ReadingResponse(reading.getId(), reading.getSensorId(), reading.getTemperature(),
                reading.getHumidity(), reading.getTimestamp());
    }
}
