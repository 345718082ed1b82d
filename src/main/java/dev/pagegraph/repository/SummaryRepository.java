package dev.pagegraph.repository;

import dev.pagegraph.domain.entity.Summary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SummaryRepository extends JpaRepository<Summary, UUID> {

    Optional<Summary> findByVisitIdAndCurrentTrue(UUID visitId);

    List<Summary> findByVisitIdInAndCurrentTrue(Collection<UUID> visitIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Summary s set s.current = false where s.visitId = :visitId and s.current = true")
    int supersedeCurrent(@Param("visitId") UUID visitId);
}
