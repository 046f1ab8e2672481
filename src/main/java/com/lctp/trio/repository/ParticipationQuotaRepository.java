package com.lctp.trio.repository;

import com.lctp.trio.entity.ParticipationQuota;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ParticipationQuotaRepository extends JpaRepository<ParticipationQuota, Long> {

    Optional<ParticipationQuota> findByCompetitor_IdAndProva_IdAndCategory_Id(Long competitorId, Long provaId, Long categoryId);

    boolean existsByCompetitor_IdAndProva_IdAndCategory_Id(Long competitorId, Long provaId, Long categoryId);

    List<ParticipationQuota> findByCompetitor_IdOrderByIdAsc(Long competitorId);

    // === Listing with optional filters ===
    @Query("""
        SELECT q FROM ParticipationQuota q
        WHERE (:provaId IS NULL OR q.prova.id = :provaId)
          AND (:categoryId IS NULL OR q.category.id = :categoryId)
          AND (:onlyBlocked = false OR q.mayCompete = false)
        ORDER BY q.competitor.id ASC, q.id ASC
        """)
    List<ParticipationQuota> search(@Param("provaId") Long provaId,
                                    @Param("categoryId") Long categoryId,
                                    @Param("onlyBlocked") boolean onlyBlocked);

    // === Atomic run registration: succeeds only while a run is still available ===
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ParticipationQuota q
        SET q.runsExecuted = q.runsExecuted + 1,
            q.version = q.version + 1
        WHERE q.id = :id
          AND q.mayCompete = true
          AND q.runsExecuted < q.maxRunsAllowed
        """)
    int incrementRunIfAvailable(@Param("id") Long id);
}
