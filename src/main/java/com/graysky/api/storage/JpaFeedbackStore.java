package com.graysky.api.storage;

import com.graysky.api.exception.StorageException;
import com.graysky.api.model.feedback.FeedbackEntity;
import com.graysky.api.model.feedback.FeedbackRecord;
import com.graysky.api.repository.FeedbackRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class JpaFeedbackStore implements FeedbackStore {

    private final FeedbackRepository feedbackRepository;
    private final TransactionTemplate writeTemplate;

    public JpaFeedbackStore(FeedbackRepository feedbackRepository, PlatformTransactionManager transactionManager) {
        this.feedbackRepository = feedbackRepository;
        this.writeTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public void insert(FeedbackRecord record) {
        try {
            feedbackRepository.save(FeedbackEntity.fromRecord(record));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save feedback " + record.getId(), e);
        }
    }

    @Override
    public List<FeedbackRecord> listRecent(int limit) {
        try {
            return feedbackRepository.findAllByOrderBySubmissionTimeDescIdAsc(PageRequest.of(0, limit)).stream()
                    .map(FeedbackEntity::toRecord)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read feedback", e);
        }
    }

    @Override
    public int trimToCapacity(int maxRecords) {
        try {
            Integer removed = writeTemplate.execute(status -> {
                long total = feedbackRepository.count();
                if (total <= maxRecords) {
                    return 0;
                }
                List<String> oldest = feedbackRepository.findIdsOldestFirst(PageRequest.of(0, (int) (total - maxRecords)));
                return feedbackRepository.deleteByIdIn(oldest);
            });
            if (removed != null && removed > 0) {
                log.info("Trimmed {} oldest feedback entries", removed);
            }
            return removed == null ? 0 : removed;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to trim feedback", e);
        }
    }
}
