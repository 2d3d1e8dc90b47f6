package com.strollie.planner.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Attractions and points of interest.
 */
@Component
public class PlaceCatalog extends JsonRecordCatalog {

    public PlaceCatalog(ObjectMapper objectMapper,
                        @Value("${catalog.places:classpath:places.json}") Resource resourceFile) {
        super(objectMapper, resourceFile);
    }

    @Override
    protected String label() {
        return "Places";
    }
}
