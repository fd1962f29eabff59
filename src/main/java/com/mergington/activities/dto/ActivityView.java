package com.mergington.activities.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mergington.activities.model.Activity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "name", "description", "schedule", "max_participants", "participants" })
public class ActivityView {
    private String name;
    private String description;
    private String schedule;

    @JsonProperty("max_participants")
    private int maxParticipants;

    private List<String> participants;

    public static ActivityView of(String name, Activity activity) {
        return ActivityView.builder()
                .name(name)
                .description(activity.getDescription())
                .schedule(activity.getSchedule())
                .maxParticipants(activity.getMaxParticipants())
                .participants(activity.getParticipants())
                .build();
    }
}
