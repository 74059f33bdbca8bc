package com.koni.thermoguard.application.service;

import com.koni.thermoguard.application.port.IrTransmitter;
import com.koni.thermoguard.application.port.NotificationPublisher;
import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.domain.event.NotificationKind;
import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.domain.model.AcStatus;
import com.koni.thermoguard.domain.model.Actor;
import com.koni.thermoguard.domain.model.AirConditioner;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.model.CommandLog;
import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.domain.model.IrSignal;
import com.koni.thermoguard.domain.model.OperationMode;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.repository.AirConditionerRepository;
import com.koni.thermoguard.domain.repository.CommandLogRepository;
import com.koni.thermoguard.domain.repository.IrSignalRepository;
import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import com.koni.thermoguard.infrastructure.observability.ThermoGuardMetrics;
import com.koni.thermoguard.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AirConditionerService.
 * Tests the command sequence, failure handling, hysteresis control and IR learning.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class AirConditionerServiceTest {

    @Mock
    private AirConditionerRepository airConditionerRepository;

    @Mock
    private CommandLogRepository commandLogRepository;

    @Mock
    private IrSignalRepository irSignalRepository;

    @Mock
    private IrTransmitter irTransmitter;

    @Mock
    private AlertService alertService;

    @Mock
    private NotificationPublisher notificationPublisher;

    @Mock
    private ThermoGuardMetrics metrics;

    private ThermoGuardProperties properties;
    private AirConditionerService service;

    private final UUID roomId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();
    private Room room;

    @BeforeEach
    void setUp() {
        properties = new ThermoGuardProperties();
        service = new AirConditionerService(airConditionerRepository, commandLogRepository, irSignalRepository,
                irTransmitter, alertService, notificationPublisher, metrics, properties);
        room = new Room(roomId, "Server Room A", 22.0, 50.0, OperationMode.AUTOMATIC, true);
    }

    @Test
    void shouldLogUpdateAndBroadcastOnSuccessfulTurnOn() {
        // Given
        AirConditioner ac = airConditioner(AcStatus.OFF, true);
        when(airConditionerRepository.findById(ac.getId())).thenReturn(Optional.of(ac));
        when(irTransmitter.send("ir-1", IrCommandType.POWER_ON, "raw-on")).thenReturn(true);

        // When
        CommandOutcome outcome = service.turnOn(ac.getId(), Actor.user(userId));

        // Then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getStatus()).isEqualTo(AcStatus.ON);
        assertThat(outcome.getMessage()).isEqualTo("AC 1 turned on");

        InOrder order = inOrder(irTransmitter, commandLogRepository, airConditionerRepository, notificationPublisher);
        order.verify(irTransmitter).send("ir-1", IrCommandType.POWER_ON, "raw-on");
        order.verify(commandLogRepository).save(any(CommandLog.class));
        order.verify(airConditionerRepository).updateStatus(eq(ac.getId()), eq(AcStatus.ON), any(Instant.class));
        order.verify(notificationPublisher).publish(any(NotificationEvent.class));

        ArgumentCaptor<CommandLog> logCaptor = ArgumentCaptor.forClass(CommandLog.class);
        verify(commandLogRepository).save(logCaptor.capture());
        CommandLog log = logCaptor.getValue();
        assertThat(log.isSuccess()).isTrue();
        assertThat(log.isAutomatic()).isFalse();
        assertThat(log.getExecutedBy()).isEqualTo(userId);
        assertThat(log.getResponse()).isEqualTo(CommandLog.RESPONSE_OK);
        verify(metrics).recordCommand(true);
    }

    @Test
    void shouldRaiseAcErrorAndKeepStatusWhenCommandFails() {
        // Given
        AirConditioner ac = airConditioner(AcStatus.OFF, true);
        when(airConditionerRepository.findById(ac.getId())).thenReturn(Optional.of(ac));
        when(irTransmitter.send(anyString(), any(), anyString())).thenReturn(false);

        // When
        CommandOutcome outcome = service.turnOn(ac.getId(), Actor.user(userId));

        // Then
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getStatus()).isEqualTo(AcStatus.OFF);

        ArgumentCaptor<CommandLog> logCaptor = ArgumentCaptor.forClass(CommandLog.class);
        verify(commandLogRepository).save(logCaptor.capture());
        assertThat(logCaptor.getValue().isSuccess()).isFalse();
        assertThat(logCaptor.getValue().getResponse()).isEqualTo(CommandLog.RESPONSE_FAILED);

        verify(alertService).createAlert(roomId, AlertType.AC_ERROR, AlertSeverity.WARNING,
                "Failed to execute power_on on AC 1");
        verify(airConditionerRepository, never()).updateStatus(any(), any(), any());
        verify(notificationPublisher, never()).publish(any());
        verify(metrics).recordCommand(false);
    }

    @Test
    void shouldTreatTransmitterExceptionAsFailure() {
        // Given
        AirConditioner ac = airConditioner(AcStatus.OFF, true);
        when(irTransmitter.send(anyString(), any(), anyString())).thenThrow(new IllegalStateException("timeout"));

        // When
        boolean sent = service.sendCommand(ac, IrCommandType.POWER_ON);

        // Then
        assertThat(sent).isFalse();
    }

    @Test
    void shouldTreatMissingIrCodeAsSentWhenSimulationIsEnabled() {
        // Given
        AirConditioner ac = airConditioner(AcStatus.OFF, false);

        // When
        boolean sent = service.sendCommand(ac, IrCommandType.POWER_ON);

        // Then
        assertThat(sent).isTrue();
        verifyNoInteractions(irTransmitter);
    }

    @Test
    void shouldFailOnMissingIrCodeWhenSimulationIsDisabled() {
        // Given
        properties.getControl().setSimulateMissingIrCodes(false);
        AirConditioner ac = airConditioner(AcStatus.OFF, false);

        // When
        boolean sent = service.sendCommand(ac, IrCommandType.POWER_ON);

        // Then
        assertThat(sent).isFalse();
        verifyNoInteractions(irTransmitter);
    }

    @Test
    void shouldRecordSystemActorForAutomaticCommands() {
        // Given
        AirConditioner ac = airConditioner(AcStatus.OFF, true);
        when(airConditionerRepository.findFirstActiveByRoomIdAndStatus(roomId, AcStatus.OFF))
                .thenReturn(Optional.of(ac));
        when(irTransmitter.send("ir-1", IrCommandType.POWER_ON, "raw-on")).thenReturn(true);

        // When
        boolean turnedOn = service.autoTurnOnAc(room);

        // Then
        assertThat(turnedOn).isTrue();
        ArgumentCaptor<CommandLog> logCaptor = ArgumentCaptor.forClass(CommandLog.class);
        verify(commandLogRepository).save(logCaptor.capture());
        assertThat(logCaptor.getValue().isAutomatic()).isTrue();
        assertThat(logCaptor.getValue().getExecutedBy()).isNull();

        ArgumentCaptor<NotificationEvent> eventCaptor = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(notificationPublisher).publish(eventCaptor.capture());
        assertThat(eventCaptor.getValue().getKind()).isEqualTo(NotificationKind.AC_STATUS_CHANGED);
        assertThat(eventCaptor.getValue().getData()).containsEntry("changed_by", "System");
    }

    @Test
    void shouldReturnFalseWhenNoUnitCanBeTurnedOn() {
        // Given
        when(airConditionerRepository.findFirstActiveByRoomIdAndStatus(roomId, AcStatus.OFF))
                .thenReturn(Optional.empty());

        // When/Then
        assertThat(service.autoTurnOnAc(room)).isFalse();
        verifyNoInteractions(irTransmitter, commandLogRepository);
    }

    @Test
    void shouldTurnOnAboveTheHysteresisBand() {
        // Given
        when(airConditionerRepository.findFirstActiveByRoomIdAndStatus(roomId, AcStatus.OFF))
                .thenReturn(Optional.empty());

        // When
        ControlAction action = service.applyHysteresis(room, 23.5);

        // Then
        assertThat(action).isEqualTo(ControlAction.TURN_ON);
        verify(airConditionerRepository).findFirstActiveByRoomIdAndStatus(roomId, AcStatus.OFF);
    }

    @Test
    void shouldTurnOffBelowTheHysteresisBand() {
        // Given
        when(airConditionerRepository.findFirstActiveByRoomIdAndStatus(roomId, AcStatus.ON))
                .thenReturn(Optional.empty());

        // When
        ControlAction action = service.applyHysteresis(room, 20.5);

        // Then
        assertThat(action).isEqualTo(ControlAction.TURN_OFF);
        verify(airConditionerRepository).findFirstActiveByRoomIdAndStatus(roomId, AcStatus.ON);
    }

    @Test
    void shouldHoldInsideTheHysteresisBand() {
        // When
        ControlAction low = service.applyHysteresis(room, 21.0);
        ControlAction high = service.applyHysteresis(room, 23.0);

        // Then
        assertThat(low).isEqualTo(ControlAction.HOLD);
        assertThat(high).isEqualTo(ControlAction.HOLD);
        verifyNoInteractions(airConditionerRepository, irTransmitter, commandLogRepository);
    }

    @Test
    void shouldToggleRunningUnitOff() {
        // Given
        AirConditioner ac = airConditioner(AcStatus.ON, true);
        when(airConditionerRepository.findById(ac.getId())).thenReturn(Optional.of(ac));
        when(irTransmitter.send("ir-1", IrCommandType.POWER_OFF, "raw-off")).thenReturn(true);

        // When
        CommandOutcome outcome = service.toggle(ac.getId(), Actor.user(userId));

        // Then
        assertThat(outcome.getStatus()).isEqualTo(AcStatus.OFF);
        verify(airConditionerRepository).updateStatus(eq(ac.getId()), eq(AcStatus.OFF), any(Instant.class));
    }

    @Test
    void shouldTurnOffAllUnitsEvenWhenOneFails() {
        // Given
        AirConditioner first = airConditioner(AcStatus.ON, true);
        AirConditioner second = new AirConditioner(UUID.randomUUID(), roomId, "AC 2", "ir-2", true,
                AcStatus.ON, codes(), null);
        when(airConditionerRepository.findActiveByStatus(roomId, AcStatus.ON)).thenReturn(List.of(first, second));
        when(irTransmitter.send("ir-1", IrCommandType.POWER_OFF, "raw-off")).thenReturn(false);
        when(irTransmitter.send("ir-2", IrCommandType.POWER_OFF, "raw-off")).thenReturn(true);

        // When
        List<CommandOutcome> outcomes = service.turnOffAll(roomId, Actor.user(userId));

        // Then
        assertThat(outcomes).extracting(CommandOutcome::isSuccess).containsExactly(false, true);
        assertThat(outcomes).extracting(CommandOutcome::getStatus).containsExactly(AcStatus.ON, AcStatus.OFF);
    }

    @Test
    void shouldRejectCommandForUnknownUnit() {
        // Given
        UUID acId = UUID.randomUUID();
        when(airConditionerRepository.findById(acId)).thenReturn(Optional.empty());

        // When/Then
        assertThatThrownBy(() -> service.turnOn(acId, Actor.user(userId)))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(irTransmitter, commandLogRepository);
    }

    @Test
    void shouldStoreLearnedSignalAndIrCode() {
        // Given
        AirConditioner ac = airConditioner(AcStatus.OFF, false);
        when(airConditionerRepository.findById(ac.getId())).thenReturn(Optional.of(ac));
        when(irSignalRepository.upsert(any(IrSignal.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        IrSignal signal = service.recordIrSignal(ac.getId(), IrCommandType.TEMP_UP, "9000,4500,560", "NEC");

        // Then
        assertThat(signal.getCommandType()).isEqualTo(IrCommandType.TEMP_UP);
        assertThat(signal.getProtocol()).isEqualTo("NEC");
        verify(airConditionerRepository).putIrCode(ac.getId(), IrCommandType.TEMP_UP, "9000,4500,560");
    }

    @Test
    void shouldRejectBlankSignal() {
        assertThatThrownBy(() -> service.recordIrSignal(UUID.randomUUID(), IrCommandType.POWER_ON, " ", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("rawSignal");
        verifyNoInteractions(irSignalRepository);
    }

    @Test
    void shouldNotStartRecordingWithoutTransmitter() {
        // Given
        AirConditioner ac = new AirConditioner(UUID.randomUUID(), roomId, "AC 1", null, true, AcStatus.OFF,
                null, null);
        when(airConditionerRepository.findById(ac.getId())).thenReturn(Optional.of(ac));

        // When/Then
        assertThat(service.startIrRecording(ac.getId(), IrCommandType.POWER_ON)).isFalse();
        verifyNoInteractions(irTransmitter);
    }

    private AirConditioner airConditioner(AcStatus status, boolean withCodes) {
        return new AirConditioner(UUID.randomUUID(), roomId, "AC 1", "ir-1", true, status,
                withCodes ? codes() : null, null);
    }

    private static Map<IrCommandType, String> codes() {
        Map<IrCommandType, String> codes = new EnumMap<>(IrCommandType.class);
        codes.put(IrCommandType.POWER_ON, "raw-on");
        codes.put(IrCommandType.POWER_OFF, "raw-off");
        return codes;
    }
}
