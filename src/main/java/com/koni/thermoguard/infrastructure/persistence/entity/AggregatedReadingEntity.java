package com.koni.thermoguard.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "aggregated_readings",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_aggregated_readings_sensor_hour", columnNames = {"sensor_id", "hour_start"})
    }
)
@Getter
@Setter
@NoArgsConstructor
public class AggregatedReadingEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sensor_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private SensorEntity sensor;

    @Column(name = "sensor_id", insertable = false, updatable = false)
    private UUID sensorId;

    @Column(name = "hour_start", nullable = false)
    private Instant hour;

    @Column(name = "temp_min")
    private Double temperatureMin;

    @Column(name = "temp_max")
    private Double temperatureMax;

    @Column(name = "temp_avg")
    private Double temperatureAvg;

    @Column(name = "humidity_min")
    private Double humidityMin;

    @Column(name = "humidity_max")
    private Double humidityMax;

    @Column(name = "humidity_avg")
    private Double humidityAvg;

    @Column(name = "reading_count", nullable = false)
    private long readingCount;

    @Column(name = "temperature_count", nullable = false)
    private long temperatureCount;

    @Column(name = "humidity_count", nullable = false)
    private long humidityCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
