package com.strollie.planner.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.error.ConfigurationException;
import com.strollie.planner.model.TravelRecord;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of travel records loaded once from a JSON array on the classpath.
 * Every query returns a fresh list, callers may reorder it freely.
 */
@Slf4j
public abstract class JsonRecordCatalog {

    private final ObjectMapper objectMapper;
    private final Resource resourceFile;
    private List<TravelRecord> records = List.of();

    protected JsonRecordCatalog(ObjectMapper objectMapper, Resource resourceFile) {
        this.objectMapper = objectMapper;
        this.resourceFile = resourceFile;
    }

    @PostConstruct
    public void init() {
        log.info("Loading {} from: {}", label(), resourceFile.getDescription());

        if (!resourceFile.exists()) {
            log.error("{} file not found: {}", label(), resourceFile.getDescription());
            throw new ConfigurationException(label() + " file not found: " + resourceFile.getDescription());
        }

        try {
            List<Map<String, Object>> rows = objectMapper.readValue(resourceFile.getInputStream(),
                    new TypeReference<List<Map<String, Object>>>() {
                    });

            records = rows.stream().map(TravelRecord::fromFields).toList();

            log.info("{} loaded. Record count: {}", label(), records.size());

        } catch (IOException e) {
            log.error("Failed to read {} JSON", label(), e);
            throw new ConfigurationException("Could not initialise " + label(), e);
        }
    }

    public List<TravelRecord> all() {
        return List.copyOf(records);
    }

    public List<TravelRecord> byCity(String city) {
        List<TravelRecord> found = records.stream().filter(r -> r.inCity(city)).toList();
        log.debug("{} in '{}': {}", label(), city, found.size());
        return found;
    }

    public Optional<TravelRecord> findByName(String city, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return byCity(city).stream()
                .filter(r -> r.getName() != null && r.getName().trim().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    protected abstract String label();
}
