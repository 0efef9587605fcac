package com.clubcricket.scorebook.repository;

import com.clubcricket.scorebook.model.Match;
import com.clubcricket.scorebook.model.MatchStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MatchRepository extends JpaRepository<Match, Long> {

    List<Match> findAllByOrderByCreatedAtDescIdDesc();

    List<Match> findByStatusOrderByCreatedAtDesc(MatchStatus status);

    // Row lock held until the surrounding transaction ends; serializes scorers on one match
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from Match m where m.id = :id")
    Optional<Match> findByIdForUpdate(@Param("id") Long id);
}
