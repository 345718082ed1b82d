package dev.pagegraph.repository;

import dev.pagegraph.domain.entity.Embedding;
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
public interface EmbeddingRepository extends JpaRepository<Embedding, UUID> {

    Optional<Embedding> findByVisitIdAndCurrentTrue(UUID visitId);

    List<Embedding> findByVisitIdInAndCurrentTrueAndModelVersion(Collection<UUID> visitIds, String modelVersion);

    /** Current embeddings of served visits (latest Done revision of each page) for one model version. */
    @Query("""
            select e from Embedding e, Visit v
            where e.visitId = v.id
              and e.current = true
              and e.modelVersion = :modelVersion
              and v.status = dev.pagegraph.domain.enums.VisitStatus.DONE
              and v.superseded = false
            """)
    List<Embedding> findServedByModelVersion(@Param("modelVersion") String modelVersion);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Embedding e set e.current = false where e.visitId = :visitId and e.current = true")
    int supersedeCurrent(@Param("visitId") UUID visitId);
}
