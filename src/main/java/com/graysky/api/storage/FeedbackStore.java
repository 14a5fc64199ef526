package com.graysky.api.storage;

import com.graysky.api.model.feedback.FeedbackRecord;

import java.util.List;

/**
 * Durable home of feedback submissions. Every submission is a new record.
 */
public interface FeedbackStore {

    void insert(FeedbackRecord record);

    /**
     * @return up to {@code limit} submissions, newest first
     */
    List<FeedbackRecord> listRecent(int limit);

    /**
     * @return number of submissions removed
     */
    int trimToCapacity(int maxRecords);
}
