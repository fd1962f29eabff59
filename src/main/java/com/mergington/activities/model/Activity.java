package com.mergington.activities.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Activity {

    private String description;
    private String schedule;

    // Informational only, signups are never rejected for being over capacity
    @JsonProperty("max_participants")
    private int maxParticipants;

    // Sign-up order, no duplicates
    @Builder.Default
    private List<String> participants = new ArrayList<>();

    public Activity copy() {
        return toBuilder()
                .participants(participants == null ? new ArrayList<>() : new ArrayList<>(participants))
                .build();
    }
}
