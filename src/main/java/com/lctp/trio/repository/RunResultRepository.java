package com.lctp.trio.repository;

import com.lctp.trio.entity.RunResult;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RunResultRepository extends JpaRepository<RunResult, Long> {

    Optional<RunResult> findByTrio_Id(Long trioId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RunResult r WHERE r.id = :id")
    Optional<RunResult> findByIdForUpdate(@Param("id") Long id);

    // Snapshot of one event (optionally one category), locked and in insertion order
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT r FROM RunResult r
        JOIN FETCH r.trio t
        WHERE r.prova.id = :provaId
          AND (:categoryId IS NULL OR t.category.id = :categoryId)
        ORDER BY r.id ASC
        """)
    List<RunResult> findForRecomputation(@Param("provaId") Long provaId, @Param("categoryId") Long categoryId);

    @Query("""
        SELECT r FROM RunResult r
        JOIN FETCH r.trio t
        WHERE r.prova.id = :provaId
          AND (:categoryId IS NULL OR t.category.id = :categoryId)
        ORDER BY r.id ASC
        """)
    List<RunResult> findByProvaAndCategory(@Param("provaId") Long provaId, @Param("categoryId") Long categoryId);
}
