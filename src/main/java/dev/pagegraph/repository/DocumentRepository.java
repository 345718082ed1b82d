package dev.pagegraph.repository;

import dev.pagegraph.domain.entity.Document;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

    Optional<Document> findByVisitIdAndCurrentTrue(UUID visitId);

    List<Document> findByVisitIdOrderByFetchedAtAsc(UUID visitId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Document d set d.current = false where d.visitId = :visitId and d.current = true")
    int supersedeCurrent(@Param("visitId") UUID visitId);
}
