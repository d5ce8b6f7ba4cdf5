package org.medquery.repository;

import org.medquery.models.entity.QueryRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QueryRecordRepository extends JpaRepository<QueryRecord, Long> {

    List<QueryRecord> findAllByOrderByTimestampDescIdDesc(Pageable pageable);

    @Query("select avg(q.executionTimeMs) from QueryRecord q")
    Double averageExecutionTimeMs();

    @Query("select coalesce(sum(q.rowCount), 0) from QueryRecord q")
    Long totalRowsRetrieved();

    @Query("select q.question, count(q) from QueryRecord q where q.question is not null "
            + "group by q.question order by count(q) desc")
    List<Object[]> topQuestions(Pageable pageable);
}
