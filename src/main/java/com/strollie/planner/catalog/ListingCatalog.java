package com.strollie.planner.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Lodging listings.
 */
@Component
public class ListingCatalog extends JsonRecordCatalog {

    public ListingCatalog(ObjectMapper objectMapper,
                          @Value("${catalog.listings:classpath:listings.json}") Resource resourceFile) {
        super(objectMapper, resourceFile);
    }

    @Override
    protected String label() {
        return "Listings";
    }
}
