package com.mergington.activities.controller;

import com.mergington.activities.service.EnrollmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/activities/{activityName}")
@RequiredArgsConstructor
public class EnrollmentController {

    private final EnrollmentService enrollmentService;

    @PostMapping("/signup")
    public ResponseEntity<?> signup(@PathVariable String activityName, @RequestParam String email) {
        return ResponseEntity.ok(Map.of("message", enrollmentService.signup(activityName, email)));
    }

    @DeleteMapping("/unregister")
    public ResponseEntity<?> unregister(@PathVariable String activityName, @RequestParam String email) {
        return ResponseEntity.ok(Map.of("message", enrollmentService.unregister(activityName, email)));
    }
}
