package com.koni.thermoguard.infrastructure.persistence.entity;

import com.koni.thermoguard.domain.model.AcStatus;
import com.koni.thermoguard.domain.model.IrCommandType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for air conditioners, with the learned IR code per command in a collection table.
 */
@Entity
@Table(
    name = "air_conditioners",
    indexes = {
        @Index(name = "idx_air_conditioners_room_status", columnList = "room_id, status")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class AirConditionerEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private RoomEntity room;

    @Column(name = "room_id", insertable = false, updatable = false)
    private UUID roomId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "transmitter_device_id", length = 100)
    private String transmitterDeviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private AcStatus status;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "last_command")
    private Instant lastCommand;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "air_conditioner_ir_codes", joinColumns = @JoinColumn(name = "air_conditioner_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "command_type", length = 20)
    @Column(name = "raw_signal", length = 8192)
    private Map<IrCommandType, String> irCodes = new EnumMap<>(IrCommandType.class);

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
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
