package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.CommandLog;
import com.koni.thermoguard.domain.repository.CommandLogRepository;
import com.koni.thermoguard.infrastructure.persistence.entity.CommandLogEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for CommandLogRepository. Command logs are append-only.
 */
@Component
@RequiredArgsConstructor
public class JpaCommandLogRepositoryAdapter implements CommandLogRepository {

    private final CommandLogJpaRepository jpaRepository;
    private final AirConditionerJpaRepository airConditionerJpaRepository;

    @Override
    public void save(CommandLog commandLog) {
        if (commandLog == null) {
            throw new IllegalArgumentException("CommandLog cannot be null");
        }
        CommandLogEntity entity = new CommandLogEntity();
        entity.setId(commandLog.getId());
        entity.setAirConditioner(airConditionerJpaRepository.getReferenceById(commandLog.getAirConditionerId()));
        entity.setAirConditionerId(commandLog.getAirConditionerId());
        entity.setCommand(commandLog.getCommand());
        entity.setExecutedBy(commandLog.getExecutedBy());
        entity.setSuccess(commandLog.isSuccess());
        entity.setResponse(commandLog.getResponse());
        entity.setAutomatic(commandLog.isAutomatic());
        entity.setCreatedAt(commandLog.getCreatedAt());
        jpaRepository.save(entity);
    }

    @Override
    public List<CommandLog> findRecentByAirConditionerId(UUID airConditionerId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        return jpaRepository.findByAirConditionerIdOrderByCreatedAtDesc(airConditionerId, PageRequest.of(0, limit))
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public int deleteOlderThan(Instant cutoff) {
        return jpaRepository.deleteOlderThan(cutoff);
    }

    private CommandLog toDomain(CommandLogEntity entity) {
        return new CommandLog(
                entity.getId(),
                entity.getAirConditionerId(),
                entity.getCommand(),
                entity.getExecutedBy(),
                entity.isSuccess(),
                entity.getResponse(),
                entity.isAutomatic(),
                entity.getCreatedAt()
        );
    }
}
