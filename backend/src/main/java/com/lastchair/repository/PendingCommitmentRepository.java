package com.lastchair.repository;

import com.lastchair.model.PendingCommitment;
import com.lastchair.model.PendingCommitmentId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PendingCommitmentRepository extends JpaRepository<PendingCommitment, PendingCommitmentId> {

    List<PendingCommitment> findByMatchIdAndPlayerWalletOrderByRoundNumberAsc(Long matchId, String playerWallet);

    Optional<PendingCommitment> findByMatchIdAndPlayerWalletAndRoundNumber(
            Long matchId,
            String playerWallet,
            Integer roundNumber
    );
}
