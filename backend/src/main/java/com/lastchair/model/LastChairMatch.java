package com.lastchair.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "last_chair_matches")
public class LastChairMatch {

    @Id
    @Column(name = "match_id", nullable = false, updatable = false)
    private Long matchId;

    @Column(name = "player_a", nullable = false, updatable = false, length = 128)
    private String playerA;

    // null until the second player joins
    @Column(name = "player_b", length = 128)
    private String playerB;

    @Column(name = "stake", nullable = false, updatable = false)
    private Long stake;

    @Column(name = "current_round", nullable = false)
    private Integer currentRound = 1;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private MatchStatus status = MatchStatus.WAITING;

    @Column(name = "score_a", nullable = false)
    private Long scoreA = 0L;

    @Column(name = "score_b", nullable = false)
    private Long scoreB = 0L;

    @Column(name = "payout_a")
    private Long payoutA;

    @Column(name = "payout_b")
    private Long payoutB;

    @Column(name = "fee")
    private Long fee;

    @Column(name = "final_split_a_bps")
    private Integer finalSplitABps;

    @Enumerated(EnumType.STRING)
    @Column(name = "fee_tier", length = 32)
    private FeeTier feeTier;

    @Column(name = "activated_at")
    private OffsetDateTime activatedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public PlayerSide sideOf(String wallet) {
        if (wallet == null) {
            return null;
        }
        if (wallet.equals(playerA)) {
            return PlayerSide.A;
        }
        if (wallet.equals(playerB)) {
            return PlayerSide.B;
        }
        return null;
    }
}
