package com.lastchair.controller.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public final class LedgerRequests {

    private LedgerRequests() {
    }

    public record FundAccountRequest(
            @NotNull(message = "amount is required")
            @Positive(message = "amount must be positive")
            Long amount
    ) {
    }
}
