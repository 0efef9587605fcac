package com.clubcricket.scorebook.repository;

import com.clubcricket.scorebook.model.ScoringAudit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScoringAuditRepository extends JpaRepository<ScoringAudit, Long> {
    List<ScoringAudit> findByMatchIdOrderByTimestampAscIdAsc(Long matchId);
}
