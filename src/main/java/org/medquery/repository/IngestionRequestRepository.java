package org.medquery.repository;

import org.medquery.models.entity.IngestionRequest;
import org.medquery.models.enums.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface IngestionRequestRepository extends JpaRepository<IngestionRequest, Long> {

    List<IngestionRequest> findByStatusOrderByCreatedAtAsc(RequestStatus status);

    /**
     * Compare-and-set on the status column. Returns 0 when the request is missing or its status
     * is no longer {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update IngestionRequest r set r.status = :next, r.resolvedAt = :resolvedAt "
            + "where r.id = :id and r.status = :expected")
    int compareAndSetStatus(@Param("id") Long id,
                            @Param("expected") RequestStatus expected,
                            @Param("next") RequestStatus next,
                            @Param("resolvedAt") Instant resolvedAt);
}
