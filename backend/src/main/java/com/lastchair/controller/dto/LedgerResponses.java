package com.lastchair.controller.dto;

import java.time.OffsetDateTime;

public final class LedgerResponses {

    private LedgerResponses() {
    }

    public record AccountBalance(
            String walletAddress,
            Long balance,
            OffsetDateTime updatedAt
    ) {
    }

    public record CustodyBalance(
            Long balance
    ) {
    }
}
