package com.lastchair.model;

public enum FeeTier {
    /** Combined score is zero: 50/50 split, 0.5% from each side. */
    TIE,
    /** Split within [4500, 5500] bps: proportional split, 0.5% from each side. */
    CLOSE,
    /** Split outside the close band: proportional split, 1% of the pot from the winner. */
    DECISIVE
}
