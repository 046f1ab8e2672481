package com.lctp.trio.repository;

import com.lctp.trio.entity.Trio;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TrioRepository extends JpaRepository<Trio, Long> {

    @EntityGraph(attributePaths = {"members", "category", "prova"})
    Optional<Trio> findByIdAndDeletedAtIsNull(Long id);

    List<Trio> findByProva_IdAndCategory_IdAndDeletedAtIsNullOrderByTrioNumberAsc(Long provaId, Long categoryId);

    boolean existsByProva_IdAndCategory_IdAndTrioNumber(Long provaId, Long categoryId, Integer trioNumber);

    @Query("""
        SELECT COALESCE(MAX(t.trioNumber), 0) FROM Trio t
        WHERE t.prova.id = :provaId
          AND t.category.id = :categoryId
        """)
    int findMaxTrioNumber(@Param("provaId") Long provaId, @Param("categoryId") Long categoryId);
}
