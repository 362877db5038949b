package com.lastchair.repository;

import com.lastchair.model.LastChairRound;
import com.lastchair.model.LastChairRoundId;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LastChairRoundRepository extends JpaRepository<LastChairRound, LastChairRoundId> {

    List<LastChairRound> findByMatchIdOrderByRoundNumberAsc(Long matchId);

    Optional<LastChairRound> findByMatchIdAndRoundNumber(Long matchId, Integer roundNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from LastChairRound r where r.matchId = :matchId and r.roundNumber = :roundNumber")
    Optional<LastChairRound> findByMatchIdAndRoundNumberForUpdate(
            @Param("matchId") Long matchId,
            @Param("roundNumber") Integer roundNumber
    );
}
