package com.lastchair.service;

import java.util.Collection;

/**
 * Custody of match stakes between lock-in and payout. Every call either fully applies or throws,
 * and runs inside the caller's transaction.
 */
public interface StakeLedger {

    /**
     * Moves {@code amount} from the payer into custody.
     *
     * @throws com.lastchair.web.LastChairException with kind LEDGER_REJECTED if the payer cannot cover it
     */
    void lock(Long matchId, String payer, long amount);

    /**
     * Takes the row locks on the given players' accounts in ascending wallet order and holds them until the
     * caller's transaction ends. Call before paying more than one account in a transaction.
     */
    void holdAccounts(Collection<String> wallets);

    /**
     * Moves {@code amount} out of custody to the recipient. Only called with {@code amount > 0}.
     */
    void pay(Long matchId, String recipient, long amount);

    /**
     * Records a settlement fee that stays in custody.
     */
    void retainFee(Long matchId, long amount);

    long custodyBalance();
}
