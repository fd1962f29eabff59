package com.mergington.activities.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergington.activities.model.Activity;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ActivitySeedLoaderTest {

    private final ActivitySeedLoader loader = new ActivitySeedLoader(new ObjectMapper());

    @Test
    void load_ShouldKeepSeedOrderAndFields() {
        Map<String, Activity> activities = loader.load(new ClassPathResource("seed/activities.json"));

        assertEquals(List.of("Chess Club", "Programming Class", "Gym Class", "Soccer Team", "Basketball Team",
                "Art Club", "Drama Club", "Math Club", "Debate Team"), List.copyOf(activities.keySet()));

        Activity chess = activities.get("Chess Club");
        assertEquals("Learn strategies and compete in chess tournaments", chess.getDescription());
        assertEquals("Fridays, 3:30 PM - 5:00 PM", chess.getSchedule());
        assertEquals(12, chess.getMaxParticipants());
        assertEquals(List.of("michael@mergington.edu", "daniel@mergington.edu"), chess.getParticipants());
    }

    @Test
    void load_ShouldFail_WhenSeedIsMissing() {
        assertThrows(IllegalStateException.class,
                () -> loader.load(new ClassPathResource("seed/does-not-exist.json")));
    }

    @Test
    void load_ShouldFail_WhenSeedIsMalformed() {
        ByteArrayResource broken = new ByteArrayResource("{\"Chess Club\": [".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalStateException.class, () -> loader.load(broken));
    }
}
