package com.mergington.activities.repository;

import com.mergington.activities.model.Document;

import java.util.List;

/**
 * Owns the uploaded documents of each activity, in submission order.
 * Activity names are not validated here.
 */
public interface DocumentRepository {

    void append(String activityName, Document document);

    /**
     * @return the activity's documents in submission order, empty if none were uploaded
     */
    List<Document> findByActivityName(String activityName);

    /**
     * Marks the first document uploaded by {@code email} under {@code filename} as verified.
     *
     * @return the verified document
     * @throws com.mergington.activities.exception.ResourceNotFoundException if there is no such document
     */
    Document markVerified(String activityName, String email, String filename);
}
