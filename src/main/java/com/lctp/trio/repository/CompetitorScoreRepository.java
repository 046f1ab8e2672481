package com.lctp.trio.repository;

import com.lctp.trio.entity.CompetitorScore;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface CompetitorScoreRepository extends JpaRepository<CompetitorScore, Long> {

    List<CompetitorScore> findByProvaIdOrderByCategoryIdAscPlacementAsc(Long provaId);

    List<CompetitorScore> findByCompetitorIdOrderByProvaIdAsc(Long competitorId);

    @Modifying(flushAutomatically = true)
    @Query("""
        DELETE FROM CompetitorScore s
        WHERE s.provaId = :provaId
          AND s.categoryId IN :categoryIds
        """)
    int deleteByProvaAndCategories(@Param("provaId") Long provaId, @Param("categoryIds") Collection<Long> categoryIds);
}
