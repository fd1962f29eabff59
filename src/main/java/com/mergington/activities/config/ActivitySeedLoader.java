package com.mergington.activities.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergington.activities.model.Activity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the startup roster of activities from a JSON object keyed by activity name.
 */
public class ActivitySeedLoader {

    private static final Logger logger = LoggerFactory.getLogger(ActivitySeedLoader.class);

    private static final TypeReference<LinkedHashMap<String, Activity>> SEED_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ActivitySeedLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Activity> load(Resource location) {
        try (InputStream in = location.getInputStream()) {
            Map<String, Activity> activities = objectMapper.readValue(in, SEED_TYPE);
            logger.info("Loaded {} activities from {}", activities.size(), location.getDescription());
            return activities;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load activity seed from " + location.getDescription(), e);
        }
    }
}
