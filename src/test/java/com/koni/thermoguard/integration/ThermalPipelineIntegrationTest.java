package com.koni.thermoguard.integration;

import com.koni.thermoguard.application.port.IrTransmitter;
import com.koni.thermoguard.application.port.NotificationPublisher;
import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.domain.event.NotificationKind;
import com.koni.thermoguard.domain.model.AcStatus;
import com.koni.thermoguard.domain.model.AirConditioner;
import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.model.CommandLog;
import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.domain.repository.AirConditionerRepository;
import com.koni.thermoguard.domain.repository.AlertRepository;
import com.koni.thermoguard.domain.repository.CommandLogRepository;
import com.koni.thermoguard.domain.repository.ReadingRepository;
import com.koni.thermoguard.domain.repository.RoomRepository;
import com.koni.thermoguard.domain.repository.SensorRepository;
import com.koni.thermoguard.infrastructure.web.security.Caller;
import com.koni.thermoguard.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests of the ingestion pipeline over HTTP with an in-memory database.
 * The IR transmitter and the notification fan-out are replaced by mocks.
 *
 * Tests:
 * - Reading above the hysteresis band turns the unit on without raising an alert
 * - Critical reading raises one critical alert and broadcasts it
 * - Unknown device is rejected without any side effect
 * - Failed command is logged and raises an ac_error alert
 */
@IntegrationTest
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ThermalPipelineIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RoomRepository roomRepository;

    @Autowired
    private SensorRepository sensorRepository;

    @Autowired
    private AirConditionerRepository airConditionerRepository;

    @Autowired
    private ReadingRepository readingRepository;

    @Autowired
    private AlertRepository alertRepository;

    @Autowired
    private CommandLogRepository commandLogRepository;

    @MockBean
    private IrTransmitter irTransmitter;

    @MockBean
    private NotificationPublisher notificationPublisher;

    private Room room;
    private Sensor sensor;
    private AirConditioner airConditioner;

    @BeforeEach
    void setUp() {
        room = Room.create("Server Room " + UUID.randomUUID());
        roomRepository.save(room);

        sensor = Sensor.register(room.getId(), "esp32-" + UUID.randomUUID(), "Rack A1");
        sensorRepository.save(sensor);

        airConditioner = AirConditioner.install(room.getId(), "AC 1", "ir-blaster-" + UUID.randomUUID());
        airConditionerRepository.save(airConditioner);
        airConditionerRepository.putIrCode(airConditioner.getId(), IrCommandType.POWER_ON, "9000,4500,560");
        airConditionerRepository.putIrCode(airConditioner.getId(), IrCommandType.POWER_OFF, "9000,4500,1690");
    }

    @Test
    void shouldTurnUnitOnAboveHysteresisBandWithoutAlert() throws Exception {
        // Given
        when(irTransmitter.send(anyString(), eq(IrCommandType.POWER_ON), anyString())).thenReturn(true);

        // When
        mockMvc.perform(post("/api/v1/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(readingJson(sensor.getDeviceId(), 23.5)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sensorId").value(sensor.getId().toString()));

        // Then
        verify(irTransmitter).send(airConditioner.getTransmitterDeviceId(), IrCommandType.POWER_ON, "9000,4500,560");
        assertThat(airConditionerRepository.findById(airConditioner.getId()).orElseThrow().getStatus())
                .isEqualTo(AcStatus.ON);

        List<CommandLog> logs = commandLogRepository.findRecentByAirConditionerId(airConditioner.getId(), 10);
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).isSuccess()).isTrue();
        assertThat(logs.get(0).isAutomatic()).isTrue();

        assertThat(alertRepository.findUnacknowledged(room.getId(), null)).isEmpty();
        assertThat(sensorRepository.findById(sensor.getId()).orElseThrow().isOnline()).isTrue();
        assertThat(readingRepository.findLatestBySensorId(sensor.getId())).isPresent();
    }

    @Test
    void shouldRaiseCriticalAlertAndBroadcastIt() throws Exception {
        // Given
        when(irTransmitter.send(anyString(), any(), anyString())).thenReturn(true);

        // When
        mockMvc.perform(post("/api/v1/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(readingJson(sensor.getDeviceId(), 28.0)))
                .andExpect(status().isCreated());

        // Then
        List<Alert> alerts = alertRepository.findUnacknowledged(room.getId(), null);
        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.HIGH_TEMP);
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alert.getMessage()).contains("28.0").contains("27.0");

        ArgumentCaptor<NotificationEvent> eventCaptor = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(notificationPublisher, atLeastOnce()).publish(eventCaptor.capture());
        assertThat(eventCaptor.getAllValues())
                .extracting(NotificationEvent::getKind)
                .contains(NotificationKind.ALERT_TRIGGERED, NotificationKind.SENSOR_READING);
    }

    @Test
    void shouldSuppressSecondCriticalAlertWithinCooldown() throws Exception {
        // Given
        when(irTransmitter.send(anyString(), any(), anyString())).thenReturn(true);

        // When
        for (double temperature : new double[]{28.0, 29.0}) {
            mockMvc.perform(post("/api/v1/readings")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(readingJson(sensor.getDeviceId(), temperature)))
                    .andExpect(status().isCreated());
        }

        // Then
        assertThat(alertRepository.countUnacknowledged(room.getId(), AlertSeverity.CRITICAL)).isEqualTo(1);
    }

    @Test
    void shouldRejectUnknownDeviceWithoutSideEffects() throws Exception {
        mockMvc.perform(post("/api/v1/readings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(readingJson("esp32-unknown-" + UUID.randomUUID(), 28.0)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));

        assertThat(readingRepository.findLatestBySensorId(sensor.getId())).isEmpty();
        assertThat(alertRepository.countUnacknowledged(room.getId(), null)).isZero();
        verify(notificationPublisher, never()).publish(any());
        verify(irTransmitter, never()).send(anyString(), any(), anyString());
    }

    @Test
    void shouldLogFailedCommandAndRaiseAcError() throws Exception {
        // Given
        when(irTransmitter.send(anyString(), any(), anyString())).thenReturn(false);
        UUID operator = UUID.randomUUID();

        // When
        mockMvc.perform(post("/api/v1/air-conditioners/{id}/turn-on", airConditioner.getId())
                        .header(Caller.USER_ID_HEADER, operator.toString())
                        .header(Caller.ROLE_HEADER, "operator"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("command_failed"));

        // Then
        List<CommandLog> logs = commandLogRepository.findRecentByAirConditionerId(airConditioner.getId(), 10);
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).isSuccess()).isFalse();
        assertThat(logs.get(0).getExecutedBy()).isEqualTo(operator);
        assertThat(airConditionerRepository.findById(airConditioner.getId()).orElseThrow().getStatus())
                .isEqualTo(AcStatus.OFF);
        assertThat(alertRepository.findUnacknowledged(room.getId(), null))
                .extracting(Alert::getType)
                .containsExactly(AlertType.AC_ERROR);
    }

    @Test
    void shouldAcknowledgeAlertOnceOverHttp() throws Exception {
        // Given
        Alert alert = Alert.raise(room.getId(), AlertType.SENSOR_OFFLINE, AlertSeverity.WARNING,
                "Sensor Rack A1 is offline");
        alertRepository.save(alert);
        String userId = UUID.randomUUID().toString();

        // When/Then
        mockMvc.perform(patch("/api/v1/alerts/{id}/acknowledge", alert.getId())
                        .header(Caller.USER_ID_HEADER, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledgedBy").value(userId));
        mockMvc.perform(patch("/api/v1/alerts/{id}/acknowledge", alert.getId())
                        .header(Caller.USER_ID_HEADER, userId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("already_acknowledged"));
    }

    private static String readingJson(String deviceId, double temperature) {
        return String.format(Locale.ROOT, "{\"deviceId\":\"%s\",\"temperature\":%.1f}", deviceId, temperature);
    }
}
