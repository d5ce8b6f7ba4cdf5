package org.medquery.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.medquery.models.enums.PayloadKind;
import org.medquery.models.enums.RequestStatus;
import org.medquery.models.enums.Role;

import java.time.Instant;

/**
 * Quarantined ingestion awaiting review. Only {@code status} and {@code resolvedAt} change after
 * creation, and only once.
 */
@Getter
@Setter
@Entity
@Table(name = "upload_requests")
public class IngestionRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "requested_by", nullable = false, length = 100, updatable = false)
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "requester_role", length = 20, updatable = false)
    private Role requesterRole;

    @Column(name = "table_name", nullable = false, length = 60, updatable = false)
    private String tableName;

    @Enumerated(EnumType.STRING)
    @Column(name = "payload_kind", nullable = false, length = 10, updatable = false)
    private PayloadKind payloadKind;

    @Column(name = "file_name", length = 255, updatable = false)
    private String fileName;

    @Column(name = "row_count", updatable = false)
    private Integer rowCount;

    @Column(name = "payload", nullable = false, length = Integer.MAX_VALUE, updatable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @ColumnDefault("'PENDING'")
    @Column(name = "status", nullable = false, length = 20)
    private RequestStatus status;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
