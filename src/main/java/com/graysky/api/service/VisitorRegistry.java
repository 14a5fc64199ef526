package com.graysky.api.service;

import com.graysky.api.model.dto.VisitRequest;
import com.graysky.api.model.visitor.VisitorRecord;

import java.util.List;

/**
 * The welcome book: records visits, folds repeat visitors into a visit count and
 * rate-limits signatures per name.
 */
public interface VisitorRegistry {

    /**
     * Record one visit.
     *
     * @return the stored record after this visit
     * @throws com.graysky.api.exception.ValidationException if a field is missing or too long
     * @throws com.graysky.api.exception.RateLimitExceededException if the name signed within the window
     * @throws com.graysky.api.exception.StorageException if the backend failed
     */
    VisitorRecord registerVisit(VisitRequest request);

    /**
     * Most recent visitors first. {@code limit} is clamped into [1, 100].
     */
    List<VisitorRecord> listVisitors(int limit);
}
