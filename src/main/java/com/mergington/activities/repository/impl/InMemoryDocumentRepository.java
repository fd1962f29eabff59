package com.mergington.activities.repository.impl;

import com.mergington.activities.exception.ResourceNotFoundException;
import com.mergington.activities.model.Document;
import com.mergington.activities.repository.DocumentRepository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<String, List<Document>> documentsByActivity = new HashMap<>();

    @Override
    public synchronized void append(String activityName, Document document) {
        Document stored = document.copy();
        stored.setVerified(false);
        documentsByActivity.computeIfAbsent(activityName, key -> new ArrayList<>()).add(stored);
    }

    @Override
    public synchronized List<Document> findByActivityName(String activityName) {
        return documentsByActivity.getOrDefault(activityName, List.of()).stream()
                .map(Document::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Document markVerified(String activityName, String email, String filename) {
        Document document = documentsByActivity.getOrDefault(activityName, List.of()).stream()
                .filter(doc -> doc.matches(email, filename))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Document not found"));
        document.setVerified(true);
        return document.copy();
    }
}
