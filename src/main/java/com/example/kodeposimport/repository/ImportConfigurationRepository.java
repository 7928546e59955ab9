package com.example.kodeposimport.repository;

import com.example.kodeposimport.entity.ImportConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ImportConfigurationRepository extends JpaRepository<ImportConfiguration, String> {

    Optional<ImportConfiguration> findByJobId(String jobId);
}
