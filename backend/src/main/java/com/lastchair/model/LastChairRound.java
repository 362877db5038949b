package com.lastchair.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@IdClass(LastChairRoundId.class)
@Table(name = "last_chair_rounds")
public class LastChairRound {

    /** Stored value of a chair or trap that has not been revealed yet. */
    public static final int UNREVEALED = 0;

    @Id
    @Column(name = "match_id", nullable = false, updatable = false)
    private Long matchId;

    @Id
    @Column(name = "round_number", nullable = false, updatable = false)
    private Integer roundNumber;

    @Column(name = "commitment_a", length = 66)
    private String commitmentA;

    @Column(name = "commitment_b", length = 66)
    private String commitmentB;

    @Column(name = "chair_a", nullable = false)
    private Integer chairA = UNREVEALED;

    @Column(name = "trap_a1", nullable = false)
    private Integer trapA1 = UNREVEALED;

    @Column(name = "trap_a2", nullable = false)
    private Integer trapA2 = UNREVEALED;

    @Column(name = "trap_a3", nullable = false)
    private Integer trapA3 = UNREVEALED;

    @Column(name = "chair_b", nullable = false)
    private Integer chairB = UNREVEALED;

    @Column(name = "trap_b1", nullable = false)
    private Integer trapB1 = UNREVEALED;

    @Column(name = "trap_b2", nullable = false)
    private Integer trapB2 = UNREVEALED;

    @Column(name = "trap_b3", nullable = false)
    private Integer trapB3 = UNREVEALED;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private RoundStatus status = RoundStatus.PENDING;

    @Column(name = "score_a", nullable = false)
    private Long scoreA = 0L;

    @Column(name = "score_b", nullable = false)
    private Long scoreB = 0L;

    @Column(name = "settled_at")
    private OffsetDateTime settledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public String commitmentOf(PlayerSide side) {
        return side == PlayerSide.A ? commitmentA : commitmentB;
    }

    public boolean hasRevealed(PlayerSide side) {
        int chair = side == PlayerSide.A ? chairA : chairB;
        return chair != UNREVEALED;
    }

    public RevealedChoice revealedChoice(PlayerSide side) {
        if (!hasRevealed(side)) {
            return null;
        }
        return side == PlayerSide.A
                ? new RevealedChoice(chairA, trapA1, trapA2, trapA3)
                : new RevealedChoice(chairB, trapB1, trapB2, trapB3);
    }

    public void recordReveal(PlayerSide side, RevealedChoice choice) {
        if (side == PlayerSide.A) {
            chairA = choice.chair();
            trapA1 = choice.trap1();
            trapA2 = choice.trap2();
            trapA3 = choice.trap3();
        } else {
            chairB = choice.chair();
            trapB1 = choice.trap1();
            trapB2 = choice.trap2();
            trapB3 = choice.trap3();
        }
    }

    public boolean isScored() {
        return status == RoundStatus.SETTLED;
    }
}
