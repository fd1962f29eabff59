package com.mergington.activities.repository;

import com.mergington.activities.model.Activity;

import java.util.Map;

/**
 * Owns the activity records keyed by their exact, case-sensitive name.
 * <p>
 * The set of activities is fixed once seeded. Only participant rosters change, and each
 * change is applied atomically. Returned records are copies.
 */
public interface ActivityRepository {

    /**
     * @return every activity in seed order
     */
    Map<String, Activity> findAll();

    boolean existsByName(String name);

    /**
     * @throws com.mergington.activities.exception.ResourceNotFoundException if no such activity
     */
    Activity getByName(String name);

    /**
     * Appends the email to the end of the activity's roster.
     *
     * @throws com.mergington.activities.exception.ResourceNotFoundException if no such activity
     * @throws com.mergington.activities.exception.BadRequestException       if already on the roster
     */
    void addParticipant(String name, String email);

    /**
     * Removes the email from the activity's roster, keeping the order of the others.
     *
     * @throws com.mergington.activities.exception.ResourceNotFoundException if no such activity
     * @throws com.mergington.activities.exception.BadRequestException       if not on the roster
     */
    void removeParticipant(String name, String email);
}
