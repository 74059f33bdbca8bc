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

@Entity
@Table(
    name = "ir_signals",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_ir_signals_ac_command", columnNames = {"air_conditioner_id", "command_type"})
    }
)
@Getter
@Setter
@NoArgsConstructor
public class IrSignalEntity {

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
    @Column(name = "command_type", nullable = false, length = 20)
    private IrCommandType commandType;

    @Column(name = "raw_signal", nullable = false, length = 8192)
    private String rawSignal;

    @Column(name = "protocol", length = 50)
    private String protocol;

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
