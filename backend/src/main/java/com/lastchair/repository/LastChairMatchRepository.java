package com.lastchair.repository;

import com.lastchair.model.LastChairMatch;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LastChairMatchRepository extends JpaRepository<LastChairMatch, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from LastChairMatch m where m.matchId = :matchId")
    Optional<LastChairMatch> findByMatchIdForUpdate(@Param("matchId") Long matchId);
}
