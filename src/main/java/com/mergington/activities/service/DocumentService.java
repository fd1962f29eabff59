package com.mergington.activities.service;

import com.mergington.activities.exception.ResourceNotFoundException;
import com.mergington.activities.model.Document;
import com.mergington.activities.repository.ActivityRepository;
import com.mergington.activities.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class DocumentService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private final ActivityRepository activityRepository;
    private final DocumentRepository documentRepository;

    /**
     * Records the metadata of an uploaded document as unverified. Any integer score is accepted.
     */
    public String submit(String activityName, String email, String filename, String contentType, int score) {
        requireActivity(activityName);

        Document document = Document.builder()
                .email(email)
                .filename(filename)
                .contentType(contentType)
                .score(score)
                .verified(false)
                .build();
        documentRepository.append(activityName, document);

        logger.info("Uploaded {} ({}) for {} in {} with score {}", filename, contentType, email, activityName, score);
        return "Uploaded " + filename + " for " + email + " in " + activityName;
    }

    public List<Document> listDocuments(String activityName) {
        requireActivity(activityName);
        return documentRepository.findByActivityName(activityName);
    }

    /**
     * Verifies the first matching document. The activity itself is not looked up, an unknown
     * activity simply has no documents.
     */
    public String verify(String activityName, String email, String filename) {
        documentRepository.markVerified(activityName, email, filename);
        logger.info("Verified {} for {} in {}", filename, email, activityName);
        return "Verified " + filename + " for " + email + " in " + activityName;
    }

    private void requireActivity(String activityName) {
        if (!activityRepository.existsByName(activityName)) {
            throw new ResourceNotFoundException("Activity not found");
        }
    }
}
