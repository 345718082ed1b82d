package dev.pagegraph.repository;

import dev.pagegraph.domain.entity.EdgeEvidence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface EdgeEvidenceRepository extends JpaRepository<EdgeEvidence, Long> {

    boolean existsByEdgeIdAndEvidenceKey(UUID edgeId, String evidenceKey);

    long countByEdgeId(UUID edgeId);
}
