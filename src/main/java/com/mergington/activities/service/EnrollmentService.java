package com.mergington.activities.service;

import com.mergington.activities.exception.ResourceNotFoundException;
import com.mergington.activities.repository.ActivityRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Signs students up for activities and removes them again.
 * Capacity is not enforced, a signup beyond max_participants still succeeds.
 */
@Service
@RequiredArgsConstructor
public class EnrollmentService {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentService.class);

    private final ActivityRepository activityRepository;

    public String signup(String activityName, String email) {
        requireActivity(activityName);
        activityRepository.addParticipant(activityName, email);
        logger.info("Signed up {} for {}", email, activityName);
        return "Signed up " + email + " for " + activityName;
    }

    public String unregister(String activityName, String email) {
        requireActivity(activityName);
        activityRepository.removeParticipant(activityName, email);
        logger.info("Unregistered {} from {}", email, activityName);
        return "Unregistered " + email + " from " + activityName;
    }

    private void requireActivity(String activityName) {
        if (!activityRepository.existsByName(activityName)) {
            throw new ResourceNotFoundException("Activity not found");
        }
    }
}
