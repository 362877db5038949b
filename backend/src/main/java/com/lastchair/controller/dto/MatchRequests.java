package com.lastchair.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class MatchRequests {

    private MatchRequests() {
    }

    public record StartMatchRequest(
            @NotBlank(message = "player is required")
            @Size(max = 128, message = "player must be at most 128 characters")
            String player,

            @NotNull(message = "stake is required")
            Long stake,

            @NotNull(message = "commitments are required")
            @Size(min = 3, max = 3, message = "exactly 3 commitments are required")
            List<@NotBlank(message = "commitment must not be blank") String> commitments
    ) {
    }

    public record RevealRequest(
            @NotBlank(message = "player is required")
            @Size(max = 128, message = "player must be at most 128 characters")
            String player,

            @NotBlank(message = "credential is required")
            String credential
    ) {
    }
}
