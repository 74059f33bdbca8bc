package com.koni.thermoguard.application.service;

import com.koni.thermoguard.domain.model.AggregatedReading;
import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.domain.repository.AggregatedReadingRepository;
import com.koni.thermoguard.domain.repository.CommandLogRepository;
import com.koni.thermoguard.domain.repository.ReadingRepository;
import com.koni.thermoguard.domain.repository.SensorRepository;
import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Retention and compaction of readings and command logs.
 *
 * Aggregation works sensor by sensor, each in its own transaction: the hourly aggregates are upserted
 * and the raw rows deleted together, and a failing sensor is logged and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadingHousekeepingService {

    private final SensorRepository sensorRepository;
    private final ReadingRepository readingRepository;
    private final AggregatedReadingRepository aggregatedReadingRepository;
    private final CommandLogRepository commandLogRepository;
    private final TransactionOperations transactionOperations;
    private final ThermoGuardProperties properties;

    public int cleanupOldReadings() {
        Instant cutoff = Instant.now().minus(properties.getReadings().getRetention());
        int deleted = readingRepository.deleteOlderThan(cutoff);
        log.info("Old readings cleaned up: deleted={}, cutoff={}", deleted, cutoff);
        return deleted;
    }

    /**
     * Compacts raw readings older than the aggregation age into hourly aggregates.
     *
     * @return number of hourly aggregates written
     */
    public int aggregateReadings() {
        Instant cutoff = Instant.now().minus(properties.getReadings().getAggregationAge());
        int aggregated = 0;

        for (Sensor sensor : sensorRepository.findAll()) {
            try {
                Integer written = transactionOperations.execute(status -> aggregateSensor(sensor, cutoff));
                aggregated += written != null ? written : 0;
            } catch (RuntimeException e) {
                log.error("Failed to aggregate readings: sensorId={}", sensor.getId(), e);
            }
        }

        log.info("Readings aggregated: hours={}, cutoff={}", aggregated, cutoff);
        return aggregated;
    }

    public int cleanupOldCommandLogs() {
        Instant cutoff = Instant.now().minus(properties.getCommandLogs().getRetention());
        int deleted = commandLogRepository.deleteOlderThan(cutoff);
        log.info("Old command logs cleaned up: deleted={}, cutoff={}", deleted, cutoff);
        return deleted;
    }

    private int aggregateSensor(Sensor sensor, Instant cutoff) {
        List<Reading> readings = readingRepository.findBySensorIdOlderThan(sensor.getId(), cutoff);
        if (readings.isEmpty()) {
            return 0;
        }

        Map<Instant, List<Reading>> byHour = readings.stream()
                .collect(Collectors.groupingBy(
                        reading -> reading.getTimestamp().truncatedTo(ChronoUnit.HOURS),
                        TreeMap::new,
                        Collectors.toList()));

        for (Map.Entry<Instant, List<Reading>> hour : byHour.entrySet()) {
            AggregatedReading summary = AggregatedReading.summarize(sensor.getId(), hour.getKey(), hour.getValue());
            AggregatedReading merged = aggregatedReadingRepository
                    .findBySensorIdAndHour(sensor.getId(), hour.getKey())
                    .map(summary::mergeWith)
                    .orElse(summary);
            aggregatedReadingRepository.upsert(merged);
        }

        int deleted = readingRepository.deleteBySensorIdOlderThan(sensor.getId(), cutoff);
        log.debug("Sensor readings aggregated: sensorId={}, hours={}, deleted={}",
                sensor.getId(), byHour.size(), deleted);
        return byHour.size();
    }
}
