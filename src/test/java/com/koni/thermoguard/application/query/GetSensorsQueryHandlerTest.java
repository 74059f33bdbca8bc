package com.koni.thermoguard.application.query;

import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.domain.repository.ReadingRepository;
import com.koni.thermoguard.domain.repository.SensorRepository;
import com.koni.thermoguard.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GetSensorsQueryHandler.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class GetSensorsQueryHandlerTest {

    @Mock
    private SensorRepository sensorRepository;

    @Mock
    private ReadingRepository readingRepository;

    @InjectMocks
    private GetSensorsQueryHandler handler;

    @Test
    void shouldReturnSensorsOfRoomWithLatestReading() {
        // Given
        UUID roomId = UUID.randomUUID();
        Instant takenAt = Instant.now();
        Sensor reporting = new Sensor(UUID.randomUUID(), roomId, "esp32-a1", "Rack A1", true, takenAt);
        Sensor silent = new Sensor(UUID.randomUUID(), roomId, "esp32-a2", "Rack A2", false, null);
        when(sensorRepository.findByRoomId(roomId)).thenReturn(List.of(reporting, silent));
        when(readingRepository.findLatestBySensorId(reporting.getId()))
                .thenReturn(Optional.of(new Reading(UUID.randomUUID(), reporting.getId(), 23.1, 47.0, takenAt)));
        when(readingRepository.findLatestBySensorId(silent.getId())).thenReturn(Optional.empty());

        // When
        List<SensorResponse> responses = handler.handle(new GetSensorsQuery(roomId));

        // Then
        assertThat(responses).hasSize(2);
        SensorResponse first = responses.get(0);
        assertThat(first.getDeviceId()).isEqualTo("esp32-a1");
        assertThat(first.isOnline()).isTrue();
        assertThat(first.getTemperature()).isEqualTo(23.1);
        assertThat(first.getHumidity()).isEqualTo(47.0);
        assertThat(first.getReadingTimestamp()).isEqualTo(takenAt);

        SensorResponse second = responses.get(1);
        assertThat(second.isOnline()).isFalse();
        assertThat(second.getTemperature()).isNull();
        assertThat(second.getReadingTimestamp()).isNull();
        verify(sensorRepository, never()).findAll();
    }

    @Test
    void shouldListAllSensorsWithoutRoomFilter() {
        // Given
        when(sensorRepository.findAll()).thenReturn(List.of());

        // When
        List<SensorResponse> responses = handler.handle(new GetSensorsQuery(null));

        // Then
        assertThat(responses).isEmpty();
        verify(sensorRepository).findAll();
    }
}
