package com.lastchair.service;

import com.lastchair.config.LastChairProperties;
import com.lastchair.model.LedgerEntry;
import com.lastchair.model.LedgerEntryType;
import com.lastchair.model.PlayerAccount;
import com.lastchair.repository.LedgerEntryRepository;
import com.lastchair.repository.PlayerAccountRepository;
import com.lastchair.web.ErrorKind;
import com.lastchair.web.LastChairException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlayerAccountServiceTest {

    @Mock
    private PlayerAccountRepository playerAccountRepository;

    @Mock
    private LedgerEntryRepository ledgerEntryRepository;

    private LastChairProperties properties;
    private PlayerAccountService playerAccountService;

    @BeforeEach
    void setUp() {
        properties = new LastChairProperties();
        playerAccountService = new PlayerAccountService(playerAccountRepository, ledgerEntryRepository, properties);
    }

    @Test
    void fundCreatesAccountAndDepositEntry() {
        when(playerAccountRepository.findByWalletForUpdate("alice")).thenReturn(Optional.empty());
        when(playerAccountRepository.save(any(PlayerAccount.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PlayerAccount account = playerAccountService.fund("alice", 2_500L);

        assertEquals("alice", account.getWalletAddress());
        assertEquals(2_500L, account.getBalance());
        ArgumentCaptor<LedgerEntry> entry = ArgumentCaptor.forClass(LedgerEntry.class);
        verify(ledgerEntryRepository).save(entry.capture());
        assertEquals(LedgerEntryType.DEPOSIT, entry.getValue().getEntryType());
        assertEquals(2_500L, entry.getValue().getAmount());
    }

    @Test
    void fundAddsToExistingBalance() {
        PlayerAccount existing = new PlayerAccount();
        existing.setWalletAddress("alice");
        existing.setBalance(500L);
        when(playerAccountRepository.findByWalletForUpdate("alice")).thenReturn(Optional.of(existing));
        when(playerAccountRepository.save(existing)).thenReturn(existing);

        assertEquals(1_500L, playerAccountService.fund("alice", 1_000L).getBalance());
    }

    @Test
    void fundingCanBeSwitchedOff() {
        properties.getLedger().setDevFundingEnabled(false);

        LastChairException error = assertThrows(LastChairException.class,
                () -> playerAccountService.fund("alice", 1_000L));

        assertEquals(ErrorKind.LEDGER_REJECTED, error.getKind());
        assertEquals("funding_disabled", error.getCode());
        verifyNoInteractions(playerAccountRepository, ledgerEntryRepository);
    }

    @Test
    void unknownAccountIsNotFound() {
        when(playerAccountRepository.findById("nobody")).thenReturn(Optional.empty());

        LastChairException error = assertThrows(LastChairException.class,
                () -> playerAccountService.getAccount("nobody"));

        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
    }
}
