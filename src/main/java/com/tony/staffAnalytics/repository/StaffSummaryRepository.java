package com.tony.staffAnalytics.repository;

import com.tony.staffAnalytics.model.StaffSummary;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StaffSummaryRepository extends JpaRepository<StaffSummary, Long> {

    List<StaffSummary> findByRunIdOrderByOverallRankAsc(String runId);

    List<StaffSummary> findByHeadCoachOrderByCreatedAtDesc(String headCoach);

    // Ligne la plus récente : donne le dernier run
    Optional<StaffSummary> findFirstByOrderByCreatedAtDesc();
}
