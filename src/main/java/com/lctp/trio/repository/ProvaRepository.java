package com.lctp.trio.repository;

import com.lctp.trio.entity.Prova;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProvaRepository extends JpaRepository<Prova, Long> {

    Optional<Prova> findByIdAndDeletedAtIsNull(Long id);

    // Active, not deleted, on or after the given date
    @Query("""
        SELECT p FROM Prova p
        WHERE p.active = true
          AND p.deletedAt IS NULL
          AND p.eventDate >= :today
        ORDER BY p.eventDate ASC, p.id ASC
        """)
    List<Prova> findUpcoming(@Param("today") LocalDate today);
}
