package com.lastchair.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime settings for the match service. Game rules (chairs, traps, rounds, fee tiers)
 * are fixed in code and intentionally absent here.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "lastchair")
public class LastChairProperties {

    private Ledger ledger = new Ledger();
    private Reveal reveal = new Reveal();

    @Getter
    @Setter
    public static class Ledger {
        /**
         * Allows crediting player accounts through the dev funding endpoint.
         */
        private boolean devFundingEnabled = true;

        /**
         * Largest stake accepted per side, keeps pot and split arithmetic inside a long.
         */
        private long maxStake = 1_000_000_000_000L;
    }

    @Getter
    @Setter
    public static class Reveal {
        private int maxCredentialBytes = 16_384;
    }
}
