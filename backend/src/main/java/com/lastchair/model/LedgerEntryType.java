package com.lastchair.model;

public enum LedgerEntryType {
    DEPOSIT,
    LOCK,
    PAYOUT,
    FEE_RETAINED
}
