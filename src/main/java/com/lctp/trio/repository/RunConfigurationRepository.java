package com.lctp.trio.repository;

import com.lctp.trio.entity.RunConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RunConfigurationRepository extends JpaRepository<RunConfiguration, Long> {

    Optional<RunConfiguration> findByProva_IdAndCategory_IdAndActiveTrue(Long provaId, Long categoryId);
}
