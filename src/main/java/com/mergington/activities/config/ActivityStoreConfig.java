package com.mergington.activities.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergington.activities.repository.ActivityRepository;
import com.mergington.activities.repository.DocumentRepository;
import com.mergington.activities.repository.impl.InMemoryActivityRepository;
import com.mergington.activities.repository.impl.InMemoryDocumentRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

@Configuration
public class ActivityStoreConfig {

    @Value("${school.activities.seed-location:classpath:seed/activities.json}")
    private Resource seedLocation;

    @Bean
    public ActivityRepository activityRepository(ObjectMapper objectMapper) {
        return new InMemoryActivityRepository(new ActivitySeedLoader(objectMapper).load(seedLocation));
    }

    @Bean
    public DocumentRepository documentRepository() {
        return new InMemoryDocumentRepository();
    }
}
