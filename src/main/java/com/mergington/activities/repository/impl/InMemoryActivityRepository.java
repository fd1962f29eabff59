package com.mergington.activities.repository.impl;

import com.mergington.activities.exception.BadRequestException;
import com.mergington.activities.exception.ResourceNotFoundException;
import com.mergington.activities.model.Activity;
import com.mergington.activities.repository.ActivityRepository;

import java.util.LinkedHashMap;
import java.util.Map;

public class InMemoryActivityRepository implements ActivityRepository {

    private final Map<String, Activity> activities = new LinkedHashMap<>();

    public InMemoryActivityRepository(Map<String, Activity> seed) {
        seed.forEach((name, activity) -> activities.put(name, activity.copy()));
    }

    @Override
    public synchronized Map<String, Activity> findAll() {
        Map<String, Activity> snapshot = new LinkedHashMap<>();
        activities.forEach((name, activity) -> snapshot.put(name, activity.copy()));
        return snapshot;
    }

    @Override
    public synchronized boolean existsByName(String name) {
        return activities.containsKey(name);
    }

    @Override
    public synchronized Activity getByName(String name) {
        return find(name).copy();
    }

    @Override
    public synchronized void addParticipant(String name, String email) {
        Activity activity = find(name);
        if (activity.getParticipants().contains(email)) {
            throw new BadRequestException("Student is already signed up");
        }
        activity.getParticipants().add(email);
    }

    @Override
    public synchronized void removeParticipant(String name, String email) {
        Activity activity = find(name);
        if (!activity.getParticipants().remove(email)) {
            throw new BadRequestException("Student is not signed up for this activity");
        }
    }

    private Activity find(String name) {
        Activity activity = activities.get(name);
        if (activity == null) {
            throw new ResourceNotFoundException("Activity not found");
        }
        return activity;
    }
}
