package com.koni.thermoguard.infrastructure.persistence.entity;

import com.koni.thermoguard.domain.model.IrCommandType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the actuation audit trail.
 */
@Entity
@Table(
    name = "command_logs",
    indexes = {
        @Index(name = "idx_command_logs_ac_created", columnList = "air_conditioner_id, created_at DESC"),
        @Index(name = "idx_command_logs_created", columnList = "created_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class CommandLogEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "air_conditioner_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private AirConditionerEntity airConditioner;

    @Column(name = "air_conditioner_id", insertable = false, updatable = false)
    private UUID airConditionerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "command", nullable = false, length = 20)
    private IrCommandType command;

    @Column(name = "executed_by")
    private UUID executedBy;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "response", length = 255)
    private String response;

    @Column(name = "is_automatic", nullable = false)
    private boolean automatic;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
