package com.tradeadvisor.backend.repository;

import com.tradeadvisor.backend.model.Recommendation;
import com.tradeadvisor.backend.model.RecommendationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecommendationRepository extends JpaRepository<Recommendation, Long> {

    Optional<Recommendation> findByIdAndUserId(Long id, Long userId);

    List<Recommendation> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable pageable);

    /**
     * Moves a live PENDING recommendation to {@code target}. Returns 0 when the row is
     * missing, owned by another user, already resolved or past its expiry.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Recommendation r SET r.status = :target, r.resolvedAt = :now "
            + "WHERE r.id = :id AND r.userId = :userId AND r.status = :pending AND r.expiresAt >= :now")
    int resolveIfPending(@Param("id") Long id,
                         @Param("userId") Long userId,
                         @Param("pending") RecommendationStatus pending,
                         @Param("target") RecommendationStatus target,
                         @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Recommendation r SET r.status = :expired, r.resolvedAt = :now "
            + "WHERE r.id = :id AND r.status = :pending AND r.expiresAt < :now")
    int expireIfOverdue(@Param("id") Long id,
                        @Param("pending") RecommendationStatus pending,
                        @Param("expired") RecommendationStatus expired,
                        @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Recommendation r SET r.status = :expired, r.resolvedAt = :now "
            + "WHERE r.status = :pending AND r.expiresAt < :now")
    int expireAllOverdue(@Param("pending") RecommendationStatus pending,
                         @Param("expired") RecommendationStatus expired,
                         @Param("now") Instant now);
}
