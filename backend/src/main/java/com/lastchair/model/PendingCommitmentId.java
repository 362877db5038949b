package com.lastchair.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class PendingCommitmentId implements Serializable {
    private Long matchId;
    private String playerWallet;
    private Integer roundNumber;
}
