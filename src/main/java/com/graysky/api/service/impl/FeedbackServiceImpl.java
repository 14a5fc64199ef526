package com.graysky.api.service.impl;

import com.graysky.api.configuration.AppProperties;
import com.graysky.api.exception.StorageException;
import com.graysky.api.exception.ValidationException;
import com.graysky.api.model.dto.FeedbackRequest;
import com.graysky.api.model.feedback.FeedbackRecord;
import com.graysky.api.service.FeedbackService;
import com.graysky.api.storage.FeedbackStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.graysky.api.util.InputSanitizer.length;
import static com.graysky.api.util.InputSanitizer.sanitize;
import static com.graysky.api.util.InputSanitizer.sanitizeOptional;

/**
 * Implementation of FeedbackService. No identity resolution and no rate limit:
 * each accepted submission becomes a new record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackServiceImpl implements FeedbackService {

    static final int MAX_AGENT_LENGTH = 100;
    static final int MAX_TEXT_LENGTH = 2000;
    static final int MIN_RATING = 1;
    static final int MAX_RATING = 10;

    private final FeedbackStore feedbackStore;
    private final AppProperties appProperties;
    private final Clock clock;

    @Override
    public FeedbackRecord submitFeedback(FeedbackRequest request) {
        Map<String, String> errors = validate(request);
        if (!errors.isEmpty()) {
            log.warn("Rejected feedback: {}", errors);
            throw new ValidationException("feedback", errors);
        }

        FeedbackRecord record = FeedbackRecord.builder()
                .id(UUID.randomUUID().toString())
                .agentName(sanitize(request.getAgentName(), MAX_AGENT_LENGTH))
                .agentType(sanitizeOptional(request.getAgentType(), MAX_AGENT_LENGTH))
                .submissionTime(LocalDateTime.now(clock))
                .issues(sanitizeOptional(request.getIssues(), MAX_TEXT_LENGTH))
                .featureRequests(sanitizeOptional(request.getFeatureRequests(), MAX_TEXT_LENGTH))
                .usabilityRating(request.getUsabilityRating())
                .additionalComments(sanitizeOptional(request.getAdditionalComments(), MAX_TEXT_LENGTH))
                .build();

        feedbackStore.insert(record);
        try {
            feedbackStore.trimToCapacity(appProperties.getFeedback().getMaxRecords());
        } catch (StorageException e) {
            log.warn("Feedback retention trim failed, will retry on next submission", e);
        }

        log.info("Feedback {} received from '{}'", record.getId(), record.getAgentName());
        return record;
    }

    @Override
    public List<FeedbackRecord> listFeedback(int limit) {
        return feedbackStore.listRecent(Math.min(Math.max(1, limit), 100));
    }

    private Map<String, String> validate(FeedbackRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (request == null) {
            errors.put("agent_name", "Agent name is required");
            return errors;
        }

        String agentName = request.getAgentName();
        if (agentName == null || agentName.trim().isEmpty()) {
            errors.put("agent_name", "Agent name is required");
        } else if (length(agentName) > MAX_AGENT_LENGTH) {
            errors.put("agent_name", "Agent name must be at most " + MAX_AGENT_LENGTH + " characters");
        }
        if (length(request.getAgentType()) > MAX_AGENT_LENGTH) {
            errors.put("agent_type", "Agent type must be at most " + MAX_AGENT_LENGTH + " characters");
        }
        checkText(errors, "issues", "Issues text", request.getIssues());
        checkText(errors, "feature_requests", "Feature requests", request.getFeatureRequests());
        checkText(errors, "additional_comments", "Additional comments", request.getAdditionalComments());

        Integer rating = request.getUsabilityRating();
        if (rating != null && (rating < MIN_RATING || rating > MAX_RATING)) {
            errors.put("usability_rating", "Usability rating must be between " + MIN_RATING + " and " + MAX_RATING);
        }
        return errors;
    }

    private static void checkText(Map<String, String> errors, String field, String label, String value) {
        if (length(value) > MAX_TEXT_LENGTH) {
            errors.put(field, label + " must be at most " + MAX_TEXT_LENGTH + " characters");
        }
    }
}
