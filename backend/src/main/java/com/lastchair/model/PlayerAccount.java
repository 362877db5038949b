package com.lastchair.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "player_accounts")
public class PlayerAccount {

    @Id
    @Column(name = "wallet_address", nullable = false, updatable = false, length = 128)
    private String walletAddress;

    @Column(name = "balance", nullable = false)
    private Long balance = 0L;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
