package com.koni.thermoguard.application.query;

import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.domain.repository.ReadingRepository;
import com.koni.thermoguard.domain.repository.SensorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Query handler for the sensor list with latest readings.
 * This is the state a dashboard loads before it starts receiving live events.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetSensorsQueryHandler {

    private final SensorRepository sensorRepository;
    private final ReadingRepository readingRepository;

    @Transactional(readOnly = true)
    public List<SensorResponse> handle(GetSensorsQuery query) {
        log.debug("Handling GetSensorsQuery: roomId={}", query.getRoomId());

        List<Sensor> sensors = query.getRoomId() != null
                ? sensorRepository.findByRoomId(query.getRoomId())
                : sensorRepository.findAll();

        List<SensorResponse> responses = sensors.stream()
                .map(this::toResponse)
                .collect(Collectors.toList());

        log.info("Retrieved {} sensors", responses.size());
        return responses;
    }

    private SensorResponse toResponse(Sensor sensor) {
        Optional<Reading> latest = readingRepository.findLatestBySensorId(sensor.getId());
        return new SensorResponse(
                sensor.getId(),
                sensor.getRoomId(),
                sensor.getDeviceId(),
                sensor.getName(),
                sensor.isOnline(),
                sensor.getLastSeen(),
                latest.map(Reading::getTemperature).orElse(null),
                latest.map(Reading::getHumidity).orElse(null),
                latest.map(Reading::getTimestamp).orElse(null)
        );
    }
}
