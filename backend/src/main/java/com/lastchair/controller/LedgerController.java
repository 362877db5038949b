package com.lastchair.controller;

import com.lastchair.controller.dto.LedgerRequests;
import com.lastchair.controller.dto.LedgerResponses;
import com.lastchair.mapper.LastChairResponseMapper;
import com.lastchair.service.PlayerAccountService;
import com.lastchair.service.StakeLedger;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final PlayerAccountService playerAccountService;
    private final StakeLedger stakeLedger;
    private final LastChairResponseMapper responseMapper;

    public LedgerController(
            PlayerAccountService playerAccountService,
            StakeLedger stakeLedger,
            LastChairResponseMapper responseMapper
    ) {
        this.playerAccountService = playerAccountService;
        this.stakeLedger = stakeLedger;
        this.responseMapper = responseMapper;
    }

    @GetMapping("/accounts/{wallet}")
    public ResponseEntity<LedgerResponses.AccountBalance> getAccount(@PathVariable String wallet) {
        return ResponseEntity.ok(responseMapper.toAccountBalanceResponse(playerAccountService.getAccount(wallet)));
    }

    /**
     * Dev-only funding; disabled unless {@code lastchair.ledger.dev-funding-enabled=true}.
     */
    @PostMapping("/accounts/{wallet}/fund")
    public ResponseEntity<LedgerResponses.AccountBalance> fundAccount(
            @PathVariable String wallet,
            @Valid @RequestBody LedgerRequests.FundAccountRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toAccountBalanceResponse(
                playerAccountService.fund(wallet, request.amount())
        ));
    }

    @GetMapping("/custody")
    public ResponseEntity<LedgerResponses.CustodyBalance> getCustody() {
        return ResponseEntity.ok(new LedgerResponses.CustodyBalance(stakeLedger.custodyBalance()));
    }
}
