package com.graysky.api.model.visitor;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One welcome book entry per visitor identity.
 *
 * Serialized with snake_case names both on the wire and in the JSON data file,
 * e.g. {@code {"id": "...", "agent_type": "GPT", "visit_time": "2025-01-01T10:00:00", ...}}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VisitorRecord {

    private String id;
    private String name;
    private String agentType;
    private String purpose;
    private LocalDateTime visitTime;
    private int visitCount;
    private Map<String, String> answers;

    public IdentityKey identity() {
        return new IdentityKey(name, agentType);
    }

    public Map<String, String> getAnswers() {
        if (answers == null) {
            answers = new LinkedHashMap<>();
        }
        return answers;
    }
}
