package dev.pagegraph.repository;

import dev.pagegraph.domain.entity.ConceptNode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConceptNodeRepository extends JpaRepository<ConceptNode, UUID> {
    Optional<ConceptNode> findByNormalizedLabel(String normalizedLabel);
}
