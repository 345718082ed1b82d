package dev.pagegraph.repository;

import dev.pagegraph.domain.entity.GraphEdge;
import dev.pagegraph.domain.enums.EdgeKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GraphEdgeRepository extends JpaRepository<GraphEdge, UUID> {

    Optional<GraphEdge> findByKindAndSourceIdAndTargetId(EdgeKind kind, UUID sourceId, UUID targetId);

    List<GraphEdge> findByKindAndTargetId(EdgeKind kind, UUID targetId);

    List<GraphEdge> findByKindAndSourceId(EdgeKind kind, UUID sourceId);

    long countByKind(EdgeKind kind);

    @Query("select e from GraphEdge e where e.sourceId = :nodeId or e.targetId = :nodeId")
    List<GraphEdge> findTouching(@Param("nodeId") UUID nodeId);

    @Query("""
            select distinct e.sourceId from GraphEdge e
            where e.kind = dev.pagegraph.domain.enums.EdgeKind.ABOUT
              and e.targetId in :conceptIds
              and e.sourceId <> :visitId
            """)
    List<UUID> findVisitsAboutAny(@Param("conceptIds") Collection<UUID> conceptIds,
                                  @Param("visitId") UUID visitId);

    /** Applied in the database so concurrent reinforcements cannot lose an update. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update GraphEdge e
            set e.weight = e.weight + :weight, e.evidenceCount = e.evidenceCount + 1, e.updatedAt = :now
            where e.id = :edgeId
            """)
    int addWeight(@Param("edgeId") UUID edgeId, @Param("weight") double weight, @Param("now") Instant now);
}
