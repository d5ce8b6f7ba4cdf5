package org.medquery.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.medquery.models.enums.Role;

import java.time.Instant;

/**
 * One executed query. Rows are only ever inserted.
 */
@Getter
@Setter
@Entity
@Table(name = "query_history")
public class QueryRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 100, updatable = false)
    private String subject;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_role", length = 20, updatable = false)
    private Role role;

    @Column(name = "question", length = Integer.MAX_VALUE, updatable = false)
    private String question;

    @Column(name = "generated_sql", nullable = false, length = Integer.MAX_VALUE, updatable = false)
    private String statement;

    @Column(name = "answer_text", length = Integer.MAX_VALUE, updatable = false)
    private String narration;

    @Column(name = "execution_time_ms", updatable = false)
    private Long executionTimeMs;

    @Column(name = "row_count", updatable = false)
    private Integer rowCount;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant timestamp;
}
