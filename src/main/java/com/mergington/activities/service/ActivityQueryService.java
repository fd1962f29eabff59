package com.mergington.activities.service;

import com.mergington.activities.dto.ActivityView;
import com.mergington.activities.dto.ParticipantScore;
import com.mergington.activities.model.Activity;
import com.mergington.activities.model.ActivitySortField;
import com.mergington.activities.model.Document;
import com.mergington.activities.model.ParticipantSortField;
import com.mergington.activities.repository.ActivityRepository;
import com.mergington.activities.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only views over activities and their verified scores.
 * <p>
 * Sorting is stable. Descending order reverses the comparator, so entries that compare equal
 * keep their original relative order in both directions.
 */
@Service
@RequiredArgsConstructor
public class ActivityQueryService {

    private final ActivityRepository activityRepository;
    private final DocumentRepository documentRepository;

    public Map<String, Activity> getActivities() {
        return activityRepository.findAll();
    }

    public List<ActivityView> sortedActivities(String sortBy, boolean descending) {
        ActivitySortField field = ActivitySortField.fromValue(sortBy);

        List<ActivityView> views = activityRepository.findAll().entrySet().stream()
                .map(entry -> ActivityView.of(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());

        Comparator<ActivityView> comparator;
        switch (field) {
            case PARTICIPANTS:
                comparator = Comparator.comparingInt(view -> view.getParticipants().size());
                break;
            case SCORE:
                Map<String, Double> averages = views.stream()
                        .collect(Collectors.toMap(ActivityView::getName, view -> averageVerifiedScore(view.getName())));
                comparator = Comparator.comparingDouble(view -> averages.get(view.getName()));
                break;
            default:
                comparator = Comparator.comparing(ActivityView::getName);
        }

        views.sort(descending ? comparator.reversed() : comparator);
        return views;
    }

    public List<ParticipantScore> sortedParticipants(String activityName, String sortBy, boolean descending) {
        ParticipantSortField field = ParticipantSortField.fromValue(sortBy);
        Activity activity = activityRepository.getByName(activityName);
        List<Document> documents = documentRepository.findByActivityName(activityName);

        List<ParticipantScore> scores = activity.getParticipants().stream()
                .map(email -> new ParticipantScore(email, firstVerifiedScore(documents, email)))
                .collect(Collectors.toList());

        Comparator<ParticipantScore> comparator;
        if (field == ParticipantSortField.SCORE) {
            // unscored participants rank as 0
            comparator = Comparator.comparingInt(entry -> entry.getScore() != null ? entry.getScore() : 0);
        } else {
            comparator = Comparator.comparing(ParticipantScore::getEmail);
        }

        scores.sort(descending ? comparator.reversed() : comparator);
        return scores;
    }

    /**
     * Mean score of the activity's verified documents, 0 when none are verified.
     */
    double averageVerifiedScore(String activityName) {
        return documentRepository.findByActivityName(activityName).stream()
                .filter(Document::isVerified)
                .mapToInt(Document::getScore)
                .average()
                .orElse(0);
    }

    private Integer firstVerifiedScore(List<Document> documents, String email) {
        return documents.stream()
                .filter(doc -> doc.isVerified() && email.equals(doc.getEmail()))
                .map(Document::getScore)
                .findFirst()
                .orElse(null);
    }
}
