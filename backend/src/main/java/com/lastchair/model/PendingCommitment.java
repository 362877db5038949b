package com.lastchair.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Commitment submitted by a player at match start, keyed by (match, player, round).
 * The first player's rows exist before the match has a second player; both sides are
 * copied into {@link LastChairRound} when the match activates.
 */
@Getter
@Setter
@Entity
@IdClass(PendingCommitmentId.class)
@Table(name = "last_chair_commitments")
public class PendingCommitment {

    @Id
    @Column(name = "match_id", nullable = false, updatable = false)
    private Long matchId;

    @Id
    @Column(name = "player_wallet", nullable = false, updatable = false, length = 128)
    private String playerWallet;

    @Id
    @Column(name = "round_number", nullable = false, updatable = false)
    private Integer roundNumber;

    @Column(name = "commitment", nullable = false, updatable = false, length = 66)
    private String commitment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
