package com.mergington.activities.controller;

import com.mergington.activities.dto.ActivityView;
import com.mergington.activities.dto.ParticipantScore;
import com.mergington.activities.model.Activity;
import com.mergington.activities.service.ActivityQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/activities")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityQueryService activityQueryService;

    @GetMapping
    public ResponseEntity<Map<String, Activity>> getActivities() {
        return ResponseEntity.ok(activityQueryService.getActivities());
    }

    /**
     * Activities ordered by name, participant count or average verified score.
     */
    @GetMapping("/sorted")
    public ResponseEntity<List<ActivityView>> getSortedActivities(
            @RequestParam(value = "sort_by", defaultValue = "name") String sortBy,
            @RequestParam(defaultValue = "false") boolean descending) {
        return ResponseEntity.ok(activityQueryService.sortedActivities(sortBy, descending));
    }

    @GetMapping("/{activityName}/participants/sorted")
    public ResponseEntity<List<ParticipantScore>> getSortedParticipants(
            @PathVariable String activityName,
            @RequestParam(value = "sort_by", defaultValue = "name") String sortBy,
            @RequestParam(defaultValue = "false") boolean descending) {
        return ResponseEntity.ok(activityQueryService.sortedParticipants(activityName, sortBy, descending));
    }
}
