package com.koni.thermoguard.application.service;

import com.koni.thermoguard.application.port.NotificationPublisher;
import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.domain.event.NotificationKind;
import com.koni.thermoguard.domain.exception.AlreadyAcknowledgedException;
import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.AlertCounts;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.model.OperationMode;
import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.repository.AlertRepository;
import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import com.koni.thermoguard.infrastructure.observability.ThermoGuardMetrics;
import com.koni.thermoguard.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AlertService.
 * Tests cooldown suppression, rule evaluation, acknowledgement and housekeeping.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    @Mock
    private AlertRepository alertRepository;

    @Mock
    private NotificationPublisher notificationPublisher;

    @Mock
    private ThermoGuardMetrics metrics;

    private ThermoGuardProperties properties;
    private AlertService alertService;

    private final UUID roomId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        properties = new ThermoGuardProperties();
        alertService = new AlertService(alertRepository, new ThresholdPolicy(properties), notificationPublisher,
                metrics, properties);
    }

    @Test
    void shouldCreateAndPublishAlertWhenNoneIsOpen() {
        // Given
        when(alertRepository.existsUnacknowledgedSince(eq(roomId), eq(AlertType.HIGH_TEMP), any(Instant.class)))
                .thenReturn(false);

        // When
        Optional<Alert> created = alertService.createAlert(roomId, AlertType.HIGH_TEMP, AlertSeverity.WARNING,
                "High temperature");

        // Then
        assertThat(created).isPresent();
        verify(alertRepository).save(created.get());
        verify(metrics).recordAlertCreated(AlertSeverity.WARNING);

        ArgumentCaptor<NotificationEvent> eventCaptor = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(notificationPublisher).publish(eventCaptor.capture());
        assertThat(eventCaptor.getValue().getKind()).isEqualTo(NotificationKind.ALERT_TRIGGERED);
        assertThat(eventCaptor.getValue().getRoomId()).isEqualTo(roomId);
    }

    @Test
    void shouldCheckCooldownWindowFromNow() {
        // Given
        ArgumentCaptor<Instant> sinceCaptor = ArgumentCaptor.forClass(Instant.class);
        when(alertRepository.existsUnacknowledgedSince(eq(roomId), eq(AlertType.HIGH_TEMP), sinceCaptor.capture()))
                .thenReturn(false);

        // When
        alertService.createAlert(roomId, AlertType.HIGH_TEMP, AlertSeverity.WARNING, "High temperature");

        // Then
        Instant expected = Instant.now().minus(Duration.ofMinutes(5));
        assertThat(sinceCaptor.getValue().toEpochMilli()).isCloseTo(expected.toEpochMilli(), within(2000L));
    }

    @Test
    void shouldSuppressAlertWithinCooldown() {
        // Given
        when(alertRepository.existsUnacknowledgedSince(eq(roomId), eq(AlertType.HIGH_TEMP), any(Instant.class)))
                .thenReturn(true);

        // When
        Optional<Alert> created = alertService.createAlert(roomId, AlertType.HIGH_TEMP, AlertSeverity.CRITICAL,
                "Critical temperature");

        // Then
        assertThat(created).isEmpty();
        verify(alertRepository, never()).save(any());
        verify(notificationPublisher, never()).publish(any());
        verify(metrics).recordAlertSuppressed();
    }

    @Test
    void shouldKeepAlertWhenBroadcastFails() {
        // Given
        when(alertRepository.existsUnacknowledgedSince(eq(roomId), eq(AlertType.AC_ERROR), any(Instant.class)))
                .thenReturn(false);
        doThrow(new IllegalStateException("broker down")).when(notificationPublisher).publish(any());

        // When
        Optional<Alert> created = alertService.createAlert(roomId, AlertType.AC_ERROR, AlertSeverity.WARNING,
                "Failed to execute power_on on AC 1");

        // Then
        assertThat(created).isPresent();
        verify(alertRepository).save(any(Alert.class));
    }

    @Test
    void shouldCreateOnlyOneAlertForConcurrentBreaches() throws Exception {
        // Given
        AtomicBoolean saved = new AtomicBoolean(false);
        when(alertRepository.existsUnacknowledgedSince(eq(roomId), eq(AlertType.HIGH_TEMP), any(Instant.class)))
                .thenAnswer(invocation -> saved.get());
        doAnswer(invocation -> {
            saved.set(true);
            return null;
        }).when(alertRepository).save(any(Alert.class));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<Optional<Alert>>> calls = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            calls.add(() -> alertService.createAlert(roomId, AlertType.HIGH_TEMP, AlertSeverity.WARNING, "High"));
        }

        // When
        List<Future<Optional<Alert>>> results = pool.invokeAll(calls);
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Then
        long created = 0;
        for (Future<Optional<Alert>> result : results) {
            if (result.get().isPresent()) {
                created++;
            }
        }
        assertThat(created).isEqualTo(1);
        verify(alertRepository, times(1)).save(any(Alert.class));
    }

    @Test
    void shouldRaiseCriticalAlertForReadingAboveCriticalLimit() {
        // Given
        Room room = new Room(roomId, "Server Room A", 22.0, 50.0, OperationMode.AUTOMATIC, true);
        Reading reading = Reading.create(UUID.randomUUID(), 28.0, null, null);
        when(alertRepository.existsUnacknowledgedSince(eq(roomId), eq(AlertType.HIGH_TEMP), any(Instant.class)))
                .thenReturn(false);

        // When
        List<Alert> alerts = alertService.evaluateReading(room, reading);

        // Then
        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(alert.getType()).isEqualTo(AlertType.HIGH_TEMP);
            assertThat(alert.getMessage()).contains("28.0").contains("27.0");
        });
    }

    @Test
    void shouldRejectAcknowledgeOfUnknownAlert() {
        // Given
        UUID alertId = UUID.randomUUID();
        when(alertRepository.findById(alertId)).thenReturn(Optional.empty());

        // When/Then
        assertThatThrownBy(() -> alertService.acknowledge(alertId, UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldAcknowledgeOpenAlert() {
        // Given
        Alert alert = Alert.raise(roomId, AlertType.HIGH_TEMP, AlertSeverity.WARNING, "High temperature");
        UUID userId = UUID.randomUUID();
        when(alertRepository.findById(alert.getId())).thenReturn(Optional.of(alert));
        when(alertRepository.acknowledge(eq(alert.getId()), eq(userId), any(Instant.class))).thenReturn(true);

        // When
        Alert acknowledged = alertService.acknowledge(alert.getId(), userId);

        // Then
        assertThat(acknowledged.isAcknowledged()).isTrue();
        assertThat(acknowledged.getAcknowledgedBy()).isEqualTo(userId);
        assertThat(acknowledged.getAcknowledgedAt()).isNotNull();
    }

    @Test
    void shouldRejectSecondAcknowledgeWithoutTouchingTheRow() {
        // Given
        Alert alert = Alert.raise(roomId, AlertType.HIGH_TEMP, AlertSeverity.WARNING, "High temperature");
        Instant firstAcknowledgedAt = Instant.now().minusSeconds(60);
        alert.markAcknowledged(UUID.randomUUID(), firstAcknowledgedAt);
        when(alertRepository.findById(alert.getId())).thenReturn(Optional.of(alert));

        // When/Then
        assertThatThrownBy(() -> alertService.acknowledge(alert.getId(), UUID.randomUUID()))
                .isInstanceOf(AlreadyAcknowledgedException.class);
        verify(alertRepository, never()).acknowledge(any(), any(), any());
        assertThat(alert.getAcknowledgedAt()).isEqualTo(firstAcknowledgedAt);
    }

    @Test
    void shouldRejectAcknowledgeThatLostTheRace() {
        // Given
        Alert alert = Alert.raise(roomId, AlertType.HIGH_TEMP, AlertSeverity.WARNING, "High temperature");
        when(alertRepository.findById(alert.getId())).thenReturn(Optional.of(alert));
        when(alertRepository.acknowledge(eq(alert.getId()), any(), any(Instant.class))).thenReturn(false);

        // When/Then
        assertThatThrownBy(() -> alertService.acknowledge(alert.getId(), UUID.randomUUID()))
                .isInstanceOf(AlreadyAcknowledgedException.class);
        assertThat(alert.isAcknowledged()).isFalse();
    }

    @Test
    void shouldCountOpenAlertsPerSeverity() {
        // Given
        when(alertRepository.countUnacknowledged(roomId, null)).thenReturn(4L);
        when(alertRepository.countUnacknowledged(roomId, AlertSeverity.CRITICAL)).thenReturn(1L);
        when(alertRepository.countUnacknowledged(roomId, AlertSeverity.WARNING)).thenReturn(3L);
        when(alertRepository.countUnacknowledged(roomId, AlertSeverity.INFO)).thenReturn(0L);

        // When
        AlertCounts counts = alertService.getActiveAlertsCount(roomId);

        // Then
        assertThat(counts).isEqualTo(new AlertCounts(4, 1, 3, 0));
    }

    @Test
    void shouldReportUnattendedCriticalAlertsWithoutModifyingThem() {
        // Given
        List<Alert> unattended = List.of(
                Alert.raise(roomId, AlertType.HIGH_TEMP, AlertSeverity.CRITICAL, "Critical temperature"),
                Alert.raise(roomId, AlertType.HIGH_TEMP, AlertSeverity.CRITICAL, "Critical temperature"));
        when(alertRepository.findUnacknowledgedCreatedBefore(eq(AlertSeverity.CRITICAL), any(Instant.class)))
                .thenReturn(unattended);

        // When
        int escalated = alertService.escalateCriticalAlerts();

        // Then
        assertThat(escalated).isEqualTo(2);
        verify(metrics, times(2)).recordAlertEscalated();
        verify(alertRepository, never()).save(any());
        verify(alertRepository, never()).acknowledge(any(), any(), any());
    }

    @Test
    void shouldDeleteAcknowledgedAlertsPastRetention() {
        // Given
        ArgumentCaptor<Instant> cutoffCaptor = ArgumentCaptor.forClass(Instant.class);
        when(alertRepository.deleteAcknowledgedCreatedBefore(cutoffCaptor.capture())).thenReturn(7);

        // When
        int deleted = alertService.cleanupOldAlerts();

        // Then
        assertThat(deleted).isEqualTo(7);
        Instant expected = Instant.now().minus(Duration.ofDays(365));
        assertThat(cutoffCaptor.getValue().toEpochMilli()).isCloseTo(expected.toEpochMilli(), within(2000L));
    }
}
