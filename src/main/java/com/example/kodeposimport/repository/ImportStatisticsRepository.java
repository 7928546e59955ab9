package com.example.kodeposimport.repository;

import com.example.kodeposimport.entity.ImportStatistics;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ImportStatisticsRepository extends JpaRepository<ImportStatistics, String> {

    List<ImportStatistics> findByJobIdOrderByCreatedAtAsc(String jobId);

    long countByJobId(String jobId);

    @Modifying
    @Query("DELETE FROM ImportStatistics s WHERE s.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
