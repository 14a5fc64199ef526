package com.graysky.api.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of {@code POST /welcome-book}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VisitRequest {

    /**
     * Required. At most 100 characters.
     */
    private String name;

    private String agentType;

    private String purpose;

    /**
     * Free-form question/answer pairs. Replaces whatever the visitor answered last time.
     */
    private Map<String, String> answers;
}
