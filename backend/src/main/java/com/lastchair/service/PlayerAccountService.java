package com.lastchair.service;

import com.lastchair.config.LastChairProperties;
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
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class PlayerAccountService {

    private static final Logger log = LoggerFactory.getLogger(PlayerAccountService.class);

    private final PlayerAccountRepository playerAccountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final LastChairProperties lastChairProperties;

    @Transactional
    public PlayerAccount fund(String wallet, long amount) {
        if (!lastChairProperties.getLedger().isDevFundingEnabled()) {
            throw LastChairException.fundingDisabled(
                    "Account funding is disabled (set lastchair.ledger.dev-funding-enabled=true for local mode)");
        }
        if (amount <= 0) {
            throw LastChairException.invalidInput("Funding amount must be positive");
        }

        OffsetDateTime now = OffsetDateTime.now();
        PlayerAccount account = playerAccountRepository.findByWalletForUpdate(wallet).orElseGet(() -> {
            PlayerAccount created = new PlayerAccount();
            created.setWalletAddress(wallet);
            created.setCreatedAt(now);
            return created;
        });
        account.setBalance(Math.addExact(account.getBalance(), amount));
        account.setUpdatedAt(now);
        PlayerAccount saved = playerAccountRepository.save(account);

        LedgerEntry entry = new LedgerEntry();
        entry.setEntryId(UUID.randomUUID());
        entry.setWalletAddress(wallet);
        entry.setEntryType(LedgerEntryType.DEPOSIT);
        entry.setAmount(amount);
        entry.setNote("dev funding");
        entry.setCreatedAt(now);
        ledgerEntryRepository.save(entry);

        log.info("Funded {} with {}, balance now {}", wallet, amount, saved.getBalance());
        return saved;
    }

    @Transactional(readOnly = true)
    public PlayerAccount getAccount(String wallet) {
        return playerAccountRepository.findById(wallet)
                .orElseThrow(() -> LastChairException.notFound("Account not found: " + wallet));
    }
}
