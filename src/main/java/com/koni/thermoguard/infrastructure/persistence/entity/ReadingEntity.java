package com.koni.thermoguard.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for raw readings. Rows are inserted once and only removed by housekeeping.
 */
@Entity
@Table(
    name = "readings",
    indexes = {
        @Index(name = "idx_readings_sensor_timestamp", columnList = "sensor_id, measured_at DESC"),
        @Index(name = "idx_readings_timestamp", columnList = "measured_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class ReadingEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sensor_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private SensorEntity sensor;

    @Column(name = "sensor_id", insertable = false, updatable = false)
    private UUID sensorId;

    @Column(name = "temperature")
    private Double temperature;

    @Column(name = "humidity")
    private Double humidity;

    @Column(name = "measured_at", nullable = false)
    private Instant timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
