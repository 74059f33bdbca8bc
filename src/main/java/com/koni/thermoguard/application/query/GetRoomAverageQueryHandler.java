package com.koni.thermoguard.application.query;

import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.domain.repository.ReadingRepository;
import com.koni.thermoguard.domain.repository.RoomRepository;
import com.koni.thermoguard.domain.repository.SensorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class GetRoomAverageQueryHandler {

    private final RoomRepository roomRepository;
    private final SensorRepository sensorRepository;
    private final ReadingRepository readingRepository;

    /**
     * @throws NotFoundException if the room does not exist
     */
    @Transactional(readOnly = true)
    public RoomAverageResponse handle(UUID roomId) {
        if (!roomRepository.existsById(roomId)) {
            throw new NotFoundException("Room not found: " + roomId);
        }

        List<Reading> latest = sensorRepository.findByRoomId(roomId).stream()
                .filter(Sensor::isOnline)
                .map(sensor -> readingRepository.findLatestBySensorId(sensor.getId()).orElse(null))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        OptionalDouble temperature = latest.stream()
                .map(Reading::getTemperature)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        OptionalDouble humidity = latest.stream()
                .map(Reading::getHumidity)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();

        log.debug("Room average computed: roomId={}, sensors={}", roomId, latest.size());
        return new RoomAverageResponse(
                roomId,
                temperature.isPresent() ? round(temperature.getAsDouble()) : null,
                humidity.isPresent() ? round(humidity.getAsDouble()) : null,
                latest.size()
        );
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
