package com.graysky.api.model.visitor;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Row in the {@code visitors} table. Answers live in {@link AnswerEntity}.
 *
 * {@code identity_key} is the SHA-256 of (name, agent_type). Its unique index is what
 * stops two concurrent first visits from creating two rows for one visitor.
 *
 * Text limits are enforced in code points; column widths are in UTF-16 units, so each
 * width is twice the enforced limit.
 */
@Data
@Entity
@Table(name = "visitors",
        uniqueConstraints = @UniqueConstraint(name = "uk_visitors_identity", columnNames = "identity_key"),
        indexes = {
                @Index(name = "idx_visitors_visit_time", columnList = "visit_time"),
                @Index(name = "idx_visitors_name", columnList = "name")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitorEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "agent_type", length = 1000)
    private String agentType;

    @Column(name = "purpose", length = 1000)
    private String purpose;

    @Column(name = "visit_time", nullable = false)
    private LocalDateTime visitTime;

    @Column(name = "visit_count", nullable = false)
    private int visitCount;

    @Column(name = "identity_key", nullable = false, length = 64)
    private String identityKey;

    public static VisitorEntity fromRecord(VisitorRecord record) {
        return VisitorEntity.builder()
                .id(record.getId())
                .name(record.getName())
                .agentType(record.getAgentType())
                .purpose(record.getPurpose())
                .visitTime(record.getVisitTime())
                .visitCount(record.getVisitCount())
                .identityKey(record.identity().digest())
                .build();
    }
}
