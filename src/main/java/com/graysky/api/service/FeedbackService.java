package com.graysky.api.service;

import com.graysky.api.model.dto.FeedbackRequest;
import com.graysky.api.model.feedback.FeedbackRecord;

import java.util.List;

/**
 * Service for collecting feedback about the site.
 */
public interface FeedbackService {

    FeedbackRecord submitFeedback(FeedbackRequest request);

    /**
     * Newest first. {@code limit} is clamped into [1, 100].
     */
    List<FeedbackRecord> listFeedback(int limit);
}
