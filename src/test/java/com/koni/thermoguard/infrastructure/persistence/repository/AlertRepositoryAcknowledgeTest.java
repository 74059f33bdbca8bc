package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.repository.AlertRepository;
import com.koni.thermoguard.domain.repository.RoomRepository;
import com.koni.thermoguard.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests acknowledgement, cooldown lookup and counts of the alert adapter.
 */
@IntegrationTest
@DataJpaTest
@Import({JpaRoomRepositoryAdapter.class, JpaAlertRepositoryAdapter.class})
@ActiveProfiles("test")
class AlertRepositoryAcknowledgeTest {

    @Autowired
    private RoomRepository roomRepository;

    @Autowired
    private AlertRepository alertRepository;

    private Room room;

    @BeforeEach
    void setUp() {
        room = Room.create("Server Room A");
        roomRepository.save(room);
    }

    @Test
    void shouldAcknowledgeOnlyOnce() {
        // Given
        Alert alert = Alert.raise(room.getId(), AlertType.HIGH_TEMP, AlertSeverity.CRITICAL, "Critical temperature");
        alertRepository.save(alert);
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        // When
        boolean firstWins = alertRepository.acknowledge(alert.getId(), first, Instant.now());
        boolean secondWins = alertRepository.acknowledge(alert.getId(), second, Instant.now());

        // Then
        assertThat(firstWins).isTrue();
        assertThat(secondWins).isFalse();
        Alert stored = alertRepository.findById(alert.getId()).orElseThrow();
        assertThat(stored.isAcknowledged()).isTrue();
        assertThat(stored.getAcknowledgedBy()).isEqualTo(first);
        assertThat(stored.getAcknowledgedAt()).isNotNull();
    }

    @Test
    void shouldFindOpenAlertOfSameTypeWithinCooldown() {
        // Given
        alertRepository.save(Alert.raise(room.getId(), AlertType.HIGH_TEMP, AlertSeverity.WARNING, "High temperature"));
        Instant since = Instant.now().minus(Duration.ofMinutes(5));

        // When/Then
        assertThat(alertRepository.existsUnacknowledgedSince(room.getId(), AlertType.HIGH_TEMP, since)).isTrue();
        assertThat(alertRepository.existsUnacknowledgedSince(room.getId(), AlertType.HIGH_HUMIDITY, since)).isFalse();
    }

    @Test
    void shouldCountAndListUnacknowledgedAlerts() {
        // Given
        Room other = Room.create("Server Room B");
        roomRepository.save(other);
        Alert critical = Alert.raise(room.getId(), AlertType.HIGH_TEMP, AlertSeverity.CRITICAL, "Critical temperature");
        Alert warning = Alert.raise(room.getId(), AlertType.SENSOR_OFFLINE, AlertSeverity.WARNING, "Sensor offline");
        Alert elsewhere = Alert.raise(other.getId(), AlertType.HIGH_HUMIDITY, AlertSeverity.WARNING, "High humidity");
        alertRepository.save(critical);
        alertRepository.save(warning);
        alertRepository.save(elsewhere);
        alertRepository.acknowledge(warning.getId(), UUID.randomUUID(), Instant.now());

        // When/Then
        assertThat(alertRepository.countUnacknowledged(null, null)).isEqualTo(2);
        assertThat(alertRepository.countUnacknowledged(room.getId(), null)).isEqualTo(1);
        assertThat(alertRepository.countUnacknowledged(null, AlertSeverity.WARNING)).isEqualTo(1);
        assertThat(alertRepository.countUnacknowledged(room.getId(), AlertSeverity.WARNING)).isZero();
        assertThat(alertRepository.findUnacknowledged(room.getId(), null))
                .extracting(Alert::getId)
                .containsExactly(critical.getId());
    }

    @Test
    void shouldDeleteOnlyAcknowledgedAlertsOlderThanCutoff() {
        // Given
        Instant old = Instant.now().minus(Duration.ofDays(400));
        Alert acknowledged = new Alert(UUID.randomUUID(), room.getId(), AlertType.LOW_TEMP, AlertSeverity.WARNING,
                "Low temperature", true, UUID.randomUUID(), old, old);
        Alert open = new Alert(UUID.randomUUID(), room.getId(), AlertType.HIGH_TEMP, AlertSeverity.CRITICAL,
                "Critical temperature", false, null, null, old);
        alertRepository.save(acknowledged);
        alertRepository.save(open);

        // When
        int deleted = alertRepository.deleteAcknowledgedCreatedBefore(Instant.now().minus(Duration.ofDays(365)));

        // Then
        assertThat(deleted).isEqualTo(1);
        assertThat(alertRepository.findById(acknowledged.getId())).isEmpty();
        assertThat(alertRepository.findById(open.getId())).isPresent();
    }
}
