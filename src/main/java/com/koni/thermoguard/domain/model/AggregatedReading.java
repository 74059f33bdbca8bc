package com.koni.thermoguard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.DoubleSummaryStatistics;
import java.util.Objects;
import java.util.UUID;

/**
 * Hourly summary of one sensor's readings. Unique per (sensor, hour).
 * Per-measurement sample counts are kept so that two summaries of the same hour can be merged exactly.
 */
@Getter
@AllArgsConstructor
public class AggregatedReading {

    private final UUID id;
    private final UUID sensorId;
    private final Instant hour;
    private final Double temperatureMin;
    private final Double temperatureMax;
    private final Double temperatureAvg;
    private final Double humidityMin;
    private final Double humidityMax;
    private final Double humidityAvg;
    private final long readingCount;
    private final long temperatureCount;
    private final long humidityCount;

    /**
     * Summarizes readings that all belong to the given hour bucket.
     */
    public static AggregatedReading summarize(UUID sensorId, Instant hour, Collection<Reading> readings) {
        DoubleSummaryStatistics temperature = readings.stream()
                .map(Reading::getTemperature)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .summaryStatistics();
        DoubleSummaryStatistics humidity = readings.stream()
                .map(Reading::getHumidity)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .summaryStatistics();

        return new AggregatedReading(
                UUID.randomUUID(),
                sensorId,
                hour.truncatedTo(ChronoUnit.HOURS),
                temperature.getCount() > 0 ? temperature.getMin() : null,
                temperature.getCount() > 0 ? temperature.getMax() : null,
                temperature.getCount() > 0 ? temperature.getAverage() : null,
                humidity.getCount() > 0 ? humidity.getMin() : null,
                humidity.getCount() > 0 ? humidity.getMax() : null,
                humidity.getCount() > 0 ? humidity.getAverage() : null,
                readings.size(),
                temperature.getCount(),
                humidity.getCount()
        );
    }

    /**
     * Combines this summary with an earlier one for the same (sensor, hour), keeping the earlier id.
     */
    public AggregatedReading mergeWith(AggregatedReading existing) {
        if (!sensorId.equals(existing.sensorId) || !hour.equals(existing.hour)) {
            throw new IllegalArgumentException("Cannot merge aggregates of different sensors or hours");
        }
        return new AggregatedReading(
                existing.id,
                sensorId,
                hour,
                min(temperatureMin, existing.temperatureMin),
                max(temperatureMax, existing.temperatureMax),
                weightedAverage(temperatureAvg, temperatureCount, existing.temperatureAvg, existing.temperatureCount),
                min(humidityMin, existing.humidityMin),
                max(humidityMax, existing.humidityMax),
                weightedAverage(humidityAvg, humidityCount, existing.humidityAvg, existing.humidityCount),
                readingCount + existing.readingCount,
                temperatureCount + existing.temperatureCount,
                humidityCount + existing.humidityCount
        );
    }

    private static Double min(Double a, Double b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : Math.min(a, b);
    }

    private static Double max(Double a, Double b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : Math.max(a, b);
    }

    private static Double weightedAverage(Double a, long countA, Double b, long countB) {
        if (a == null || countA == 0) {
            return b;
        }
        if (b == null || countB == 0) {
            return a;
        }
        return (a * countA + b * countB) / (countA + countB);
    }
}
