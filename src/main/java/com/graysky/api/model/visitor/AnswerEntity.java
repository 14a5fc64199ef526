package com.graysky.api.model.visitor;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * One answer key/value pair owned by a visitor. Rows go away with their visitor
 * through the {@code ON DELETE CASCADE} foreign key.
 */
@Data
@Entity
@Table(name = "answers", indexes = @Index(name = "idx_answers_visitor", columnList = "visitor_id"))
@NoArgsConstructor
@AllArgsConstructor
public class AnswerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "visitor_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private VisitorEntity visitor;

    @Column(name = "key", nullable = false, length = 100)
    private String key;

    @Column(name = "value", nullable = false, length = 1000)
    private String value;

    public AnswerEntity(VisitorEntity visitor, String key, String value) {
        this.visitor = visitor;
        this.key = key;
        this.value = value;
    }
}
