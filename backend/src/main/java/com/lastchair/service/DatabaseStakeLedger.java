package com.lastchair.service;

import com.lastchair.model.LedgerEntry;
import com.lastchair.model.LedgerEntryType;
import com.lastchair.model.PlayerAccount;
import com.lastchair.repository.LedgerEntryRepository;
import com.lastchair.repository.PlayerAccountRepository;
import com.lastchair.web.LastChairException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.TreeSet;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class DatabaseStakeLedger implements StakeLedger {

    private static final Logger log = LoggerFactory.getLogger(DatabaseStakeLedger.class);

    private final PlayerAccountRepository playerAccountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void lock(Long matchId, String payer, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Lock amount must be positive");
        }
        PlayerAccount account = playerAccountRepository.findByWalletForUpdate(payer)
                .orElseThrow(() -> LastChairException.insufficientFunds("No funded account for " + payer));
        if (account.getBalance() < amount) {
            throw LastChairException.insufficientFunds(
                    "Balance " + account.getBalance() + " cannot cover stake " + amount + " for " + payer);
        }

        OffsetDateTime now = OffsetDateTime.now();
        account.setBalance(account.getBalance() - amount);
        account.setUpdatedAt(now);
        playerAccountRepository.save(account);

        appendEntry(matchId, payer, LedgerEntryType.LOCK, amount, "stake locked", now);
        log.info("Locked {} from {} for match {}", amount, payer, matchId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void holdAccounts(Collection<String> wallets) {
        for (String wallet : new TreeSet<>(wallets)) {
            playerAccountRepository.findByWalletForUpdate(wallet);
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void pay(Long matchId, String recipient, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Payout amount must be positive");
        }
        long custody = custodyBalance();
        if (custody < amount) {
            log.warn("Custody balance {} is below payout {} for match {}", custody, amount, matchId);
            throw new IllegalStateException("Custody cannot cover payout of " + amount);
        }

        OffsetDateTime now = OffsetDateTime.now();
        PlayerAccount account = playerAccountRepository.findByWalletForUpdate(recipient)
                .orElseGet(() -> newAccount(recipient, now));
        account.setBalance(Math.addExact(account.getBalance(), amount));
        account.setUpdatedAt(now);
        playerAccountRepository.save(account);

        appendEntry(matchId, recipient, LedgerEntryType.PAYOUT, amount, "match payout", now);
        log.info("Paid {} to {} for match {}", amount, recipient, matchId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void retainFee(Long matchId, long amount) {
        if (amount <= 0) {
            return;
        }
        appendEntry(matchId, null, LedgerEntryType.FEE_RETAINED, amount, "settlement fee held in custody",
                OffsetDateTime.now());
    }

    @Override
    @Transactional(readOnly = true)
    public long custodyBalance() {
        long locked = ledgerEntryRepository.sumAmountByEntryType(LedgerEntryType.LOCK);
        long paid = ledgerEntryRepository.sumAmountByEntryType(LedgerEntryType.PAYOUT);
        return locked - paid;
    }

    private PlayerAccount newAccount(String wallet, OffsetDateTime now) {
        PlayerAccount account = new PlayerAccount();
        account.setWalletAddress(wallet);
        account.setBalance(0L);
        account.setCreatedAt(now);
        account.setUpdatedAt(now);
        return account;
    }

    private void appendEntry(
            Long matchId,
            String wallet,
            LedgerEntryType type,
            long amount,
            String note,
            OffsetDateTime now
    ) {
        LedgerEntry entry = new LedgerEntry();
        entry.setEntryId(UUID.randomUUID());
        entry.setMatchId(matchId);
        entry.setWalletAddress(wallet);
        entry.setEntryType(type);
        entry.setAmount(amount);
        entry.setNote(note);
        entry.setCreatedAt(now);
        ledgerEntryRepository.save(entry);
    }
}
