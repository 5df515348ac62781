package com.deepansh.desk.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only fare lookup: train fares by station pair, fixed fares for
 * bus / taxi / airplane. Amounts are whole yen.
 */
@Slf4j
public class FareTable {

    private final Map<String, Long> trainFares;
    private final Map<TransportType, Long> fixedFares;

    public FareTable(Map<String, Long> trainFares, Map<TransportType, Long> fixedFares) {
        this.trainFares = Map.copyOf(trainFares);
        this.fixedFares = Map.copyOf(fixedFares);
    }

    /**
     * Loads the table from a classpath JSON resource.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static FareTable load(ObjectMapper objectMapper, String classpathLocation) {
        ClassPathResource resource = new ClassPathResource(classpathLocation);
        try (InputStream in = resource.getInputStream()) {
            FareFile file = objectMapper.readValue(in, FareFile.class);
            Map<String, Long> train = new LinkedHashMap<>();
            for (TrainFare f : file.getTrainFares()) {
                train.put(key(f.getDeparture(), f.getDestination()), f.getFare());
            }
            Map<TransportType, Long> fixed = new LinkedHashMap<>();
            file.getFixedFares().forEach((name, fare) -> TransportType.fromText(name)
                    .ifPresentOrElse(t -> fixed.put(t, fare),
                            () -> log.warn("Ignoring fixed fare for unknown transport '{}'", name)));
            log.info("Fare table loaded from {} [trainRoutes={}, fixedFares={}]",
                    classpathLocation, train.size(), fixed.size());
            return new FareTable(train, fixed);
        } catch (IOException e) {
            throw new IllegalStateException("Could not load fare table from " + classpathLocation, e);
        }
    }

    public Optional<Long> lookup(String departure, String destination, TransportType transport) {
        if (transport == TransportType.TRAIN) {
            return Optional.ofNullable(trainFares.get(key(departure, destination)));
        }
        return Optional.ofNullable(fixedFares.get(transport));
    }

    private static String key(String departure, String destination) {
        return normalize(departure) + "->" + normalize(destination);
    }

    private static String normalize(String station) {
        return station == null ? "" : station.trim().toLowerCase();
    }

    @Data
    static class FareFile {
        private List<TrainFare> trainFares = new ArrayList<>();
        private Map<String, Long> fixedFares = new LinkedHashMap<>();
    }

    @Data
    static class TrainFare {
        private String departure;
        private String destination;
        private long fare;
    }
}
