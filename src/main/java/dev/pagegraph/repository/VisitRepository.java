package dev.pagegraph.repository;

import dev.pagegraph.domain.entity.Visit;
import dev.pagegraph.domain.enums.VisitStatus;
import org.springframework.data.domain.Pageable;
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
public interface VisitRepository extends JpaRepository<Visit, UUID> {

    Optional<Visit> findTopByFingerprintOrderByRevisionDesc(String fingerprint);

    List<Visit> findByFingerprintOrderByRevisionDesc(String fingerprint);

    List<Visit> findByHostAndActiveFingerprintIsNotNull(String host);

    long countByStatus(VisitStatus status);

    /**
     * Non-terminal visits no live lease holds and no backoff delays, oldest first.
     * Covers throttled events, scheduled retries and work interrupted by a restart.
     */
    @Query("""
            select v from Visit v
            where v.activeFingerprint is not null
              and (v.leaseOwner is null or v.leaseExpiresAt <= :now)
              and (v.retryAt is null or v.retryAt <= :now)
            order by v.createdAt asc
            """)
    List<Visit> findRunnable(@Param("now") Instant now, Pageable pageable);

    /** Served visits (latest completed revision of their page) among the given ids, newest first. */
    @Query("""
            select v from Visit v
            where v.id in :ids
              and v.status = dev.pagegraph.domain.enums.VisitStatus.DONE
              and v.superseded = false
              and v.fingerprint <> :excludedFingerprint
            order by v.completedAt desc
            """)
    List<Visit> findServedAmong(@Param("ids") Collection<UUID> ids,
                                @Param("excludedFingerprint") String excludedFingerprint,
                                Pageable pageable);

    @Query("""
            select v from Visit v
            where v.id in :ids
              and v.status = dev.pagegraph.domain.enums.VisitStatus.DONE
              and v.superseded = false
            """)
    List<Visit> findServedByIds(@Param("ids") Collection<UUID> ids);

    /** Drops every lease whose owner name starts with {@code ownerPrefix}; used once at node start. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Visit v set v.leaseOwner = null, v.leaseExpiresAt = null, v.version = v.version + 1
            where v.leaseOwner like :ownerPrefix
            """)
    int releaseLeasesByOwnerPrefix(@Param("ownerPrefix") String ownerPrefix);
}
