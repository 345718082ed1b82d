package dev.pagegraph.repository;

import dev.pagegraph.domain.entity.VisitEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface VisitEventRepository extends JpaRepository<VisitEventRecord, Long> {

    List<VisitEventRecord> findByVisitIdOrderByObservedAtAscIdAsc(UUID visitId);

    List<VisitEventRecord> findByFingerprintOrderByIdAsc(String fingerprint);

    long countByVisitId(UUID visitId);

    @Query("select max(e.observedAt) from VisitEventRecord e where e.visitId = :visitId")
    Instant findLatestObservedAt(@Param("visitId") UUID visitId);
}
