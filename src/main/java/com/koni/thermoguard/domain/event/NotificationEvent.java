package com.koni.thermoguard.domain.event;

import com.koni.thermoguard.domain.model.Actor;
import com.koni.thermoguard.domain.model.AirConditioner;
import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Sensor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Real-time notification pushed to dashboard subscribers.
 * Every event is delivered to the {@code dashboard} topic and to the topic of the room it concerns.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class NotificationEvent {

    public static final String DASHBOARD_TOPIC = "dashboard";
    public static final String ROOM_TOPIC_PREFIX = "room:";

    private final UUID eventId;
    private final NotificationKind kind;
    private final UUID roomId;
    private final Map<String, Object> data;
    private final Instant occurredAt;

    public NotificationEvent(UUID eventId, NotificationKind kind, UUID roomId, Map<String, Object> data,
                             Instant occurredAt) {
        this.eventId = eventId;
        this.kind = kind;
        this.roomId = roomId;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.occurredAt = occurredAt;
    }

    public static NotificationEvent sensorReading(Sensor sensor, Reading reading) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("room_id", sensor.getRoomId().toString());
        data.put("sensor_id", sensor.getId().toString());
        data.put("temperature", reading.getTemperature());
        data.put("humidity", reading.getHumidity());
        data.put("timestamp", reading.getTimestamp().toString());
        return of(NotificationKind.SENSOR_READING, sensor.getRoomId(), data);
    }

    public static NotificationEvent acStatusChanged(AirConditioner airConditioner, Actor actor) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("room_id", airConditioner.getRoomId().toString());
        data.put("ac_id", airConditioner.getId().toString());
        data.put("status", airConditioner.getStatus().code());
        data.put("changed_by", actor.describe());
        return of(NotificationKind.AC_STATUS_CHANGED, airConditioner.getRoomId(), data);
    }

    public static NotificationEvent alertTriggered(Alert alert) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("room_id", alert.getRoomId().toString());
        data.put("alert_id", alert.getId().toString());
        data.put("alert_type", alert.getType().code());
        data.put("severity", alert.getSeverity().code());
        data.put("message", alert.getMessage());
        return of(NotificationKind.ALERT_TRIGGERED, alert.getRoomId(), data);
    }

    public static NotificationEvent connectionStatus(Sensor sensor, boolean online) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sensor_id", sensor.getId().toString());
        data.put("sensor_name", sensor.getName());
        data.put("device_id", sensor.getDeviceId());
        data.put("is_online", online);
        data.put("room_id", sensor.getRoomId().toString());
        return of(NotificationKind.CONNECTION_STATUS, sensor.getRoomId(), data);
    }

    private static NotificationEvent of(NotificationKind kind, UUID roomId, Map<String, Object> data) {
        return new NotificationEvent(UUID.randomUUID(), kind, roomId, data, Instant.now());
    }

    /**
     * Topics this event is delivered to, dashboard first.
     */
    public List<String> topics() {
        return List.of(DASHBOARD_TOPIC, ROOM_TOPIC_PREFIX + roomId);
    }

    /**
     * Wire body: {@code {type, data, timestamp}}.
     */
    public Map<String, Object> toMessage() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", kind.code());
        message.put("data", data);
        message.put("timestamp", occurredAt.toString());
        return message;
    }
}
