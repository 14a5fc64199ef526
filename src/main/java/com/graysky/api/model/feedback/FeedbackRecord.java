package com.graysky.api.model.feedback;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A feedback submission. Unlike visitors, every submission is its own record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FeedbackRecord {

    private String id;
    private String agentName;
    private String agentType;
    private LocalDateTime submissionTime;
    private String issues;
    private String featureRequests;
    private Integer usabilityRating;
    private String additionalComments;
}
