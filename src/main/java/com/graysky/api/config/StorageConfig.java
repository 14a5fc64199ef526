package com.graysky.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graysky.api.configuration.AppProperties;
import com.graysky.api.repository.AnswerRepository;
import com.graysky.api.repository.FeedbackRepository;
import com.graysky.api.repository.VisitorRepository;
import com.graysky.api.storage.FeedbackStore;
import com.graysky.api.storage.JpaFeedbackStore;
import com.graysky.api.storage.JpaVisitorStore;
import com.graysky.api.storage.JsonFileFeedbackStore;
import com.graysky.api.storage.JsonFileVisitorStore;
import com.graysky.api.storage.VisitorStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Picks the storage backend at startup from {@code app.visitors.storage}.
 *
 * <ul>
 *   <li>{@code jpa} (default) - {@code visitors}, {@code answers} and {@code feedback} tables</li>
 *   <li>{@code file} - JSON documents at {@code app.visitors.data-file} and {@code app.feedback.data-file}</li>
 * </ul>
 */
@Configuration
public class StorageConfig {

    private static final String STORAGE_PREFIX = "app.visitors";

    @Bean
    @ConditionalOnProperty(prefix = STORAGE_PREFIX, name = "storage", havingValue = "file")
    public VisitorStore jsonFileVisitorStore(AppProperties appProperties, ObjectMapper objectMapper) {
        return new JsonFileVisitorStore(Path.of(appProperties.getVisitors().getDataFile()), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = STORAGE_PREFIX, name = "storage", havingValue = "jpa", matchIfMissing = true)
    public VisitorStore jpaVisitorStore(VisitorRepository visitorRepository,
                                        AnswerRepository answerRepository,
                                        PlatformTransactionManager transactionManager) {
        return new JpaVisitorStore(visitorRepository, answerRepository, transactionManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = STORAGE_PREFIX, name = "storage", havingValue = "file")
    public FeedbackStore jsonFileFeedbackStore(AppProperties appProperties, ObjectMapper objectMapper) {
        return new JsonFileFeedbackStore(Path.of(appProperties.getFeedback().getDataFile()), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = STORAGE_PREFIX, name = "storage", havingValue = "jpa", matchIfMissing = true)
    public FeedbackStore jpaFeedbackStore(FeedbackRepository feedbackRepository,
                                          PlatformTransactionManager transactionManager) {
        return new JpaFeedbackStore(feedbackRepository, transactionManager);
    }

    /**
     * Source of "now" for visit timestamps and the rate-limit window.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
