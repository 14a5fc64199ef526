package com.graysky.api.model.feedback;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "feedback", indexes = @Index(name = "idx_feedback_submission_time", columnList = "submission_time"))
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "agent_name", nullable = false, length = 200)
    private String agentName;

    @Column(name = "agent_type", length = 200)
    private String agentType;

    @Column(name = "submission_time", nullable = false)
    private LocalDateTime submissionTime;

    @Column(name = "issues", length = 4000)
    private String issues;

    @Column(name = "feature_requests", length = 4000)
    private String featureRequests;

    @Column(name = "usability_rating")
    private Integer usabilityRating;

    @Column(name = "additional_comments", length = 4000)
    private String additionalComments;

    public static FeedbackEntity fromRecord(FeedbackRecord record) {
        return FeedbackEntity.builder()
                .id(record.getId())
                .agentName(record.getAgentName())
                .agentType(record.getAgentType())
                .submissionTime(record.getSubmissionTime())
                .issues(record.getIssues())
                .featureRequests(record.getFeatureRequests())
                .usabilityRating(record.getUsabilityRating())
                .additionalComments(record.getAdditionalComments())
                .build();
    }

    public FeedbackRecord toRecord() {
        return FeedbackRecord.builder()
                .id(id)
                .agentName(agentName)
                .agentType(agentType)
                .submissionTime(submissionTime)
                .issues(issues)
                .featureRequests(featureRequests)
                .usabilityRating(usabilityRating)
                .additionalComments(additionalComments)
                .build();
    }
}
