package com.lctp.trio.repository;

import com.lctp.trio.entity.Competitor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CompetitorRepository extends JpaRepository<Competitor, Long> {

    Optional<Competitor> findByIdAndDeletedAtIsNull(Long id);

    List<Competitor> findByIdInAndDeletedAtIsNull(Collection<Long> ids);
}
