package com.koni.thermoguard.domain.model;

import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class ReadingTest {

    private final UUID sensorId = UUID.randomUUID();

    @Test
    void shouldCreateReadingWithOnlyTemperature() {
        // When
        Reading reading = Reading.create(sensorId, 23.5, null, null);

        // Then
        assertThat(reading.getId()).isNotNull();
        assertThat(reading.hasTemperature()).isTrue();
        assertThat(reading.hasHumidity()).isFalse();
        assertThat(reading.getTimestamp()).isNotNull();
    }

    @Test
    void shouldKeepSuppliedTimestamp() {
        // Given
        Instant takenAt = Instant.parse("2025-03-01T10:15:00Z");

        // When
        Reading reading = Reading.create(sensorId, null, 45.0, takenAt);

        // Then
        assertThat(reading.getTimestamp()).isEqualTo(takenAt);
    }

    @Test
    void shouldRejectReadingWithoutAnyValue() {
        assertThatThrownBy(() -> Reading.create(sensorId, null, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("At least one of temperature or humidity is required");
    }

    @Test
    void shouldRejectTemperatureOutOfRange() {
        assertThatThrownBy(() -> Reading.validateValues(80.1, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("temperature");
        assertThatThrownBy(() -> Reading.validateValues(-40.5, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Reading.validateValues(Double.NaN, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectHumidityOutOfRange() {
        assertThatThrownBy(() -> Reading.validateValues(null, 100.5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("humidity");
        assertThatThrownBy(() -> Reading.validateValues(22.0, -1.0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldAcceptBoundaryValues() {
        assertThatCode(() -> Reading.validateValues(-40.0, 0.0)).doesNotThrowAnyException();
        assertThatCode(() -> Reading.validateValues(80.0, 100.0)).doesNotThrowAnyException();
    }

    @Test
    void shouldRequireSensorId() {
        assertThatThrownBy(() -> Reading.create(null, 22.0, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sensorId is required");
    }
}
