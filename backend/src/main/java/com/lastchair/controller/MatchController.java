package com.lastchair.controller;

import com.lastchair.controller.dto.MatchRequests;
import com.lastchair.controller.dto.MatchResponses;
import com.lastchair.mapper.LastChairResponseMapper;
import com.lastchair.service.MatchLifecycleService;
import com.lastchair.service.MatchQueryService;
import com.lastchair.service.RoundRevealService;
import com.lastchair.service.SettlementService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST adapter over the match operations. The {@code player} field is the caller of a forwarded,
 * caller-signed request; settlement endpoints take no caller since anyone may trigger them.
 */
@RestController
@RequestMapping("/api/matches")
public class MatchController {

    private final MatchLifecycleService matchLifecycleService;
    private final RoundRevealService roundRevealService;
    private final SettlementService settlementService;
    private final MatchQueryService matchQueryService;
    private final LastChairResponseMapper responseMapper;

    public MatchController(
            MatchLifecycleService matchLifecycleService,
            RoundRevealService roundRevealService,
            SettlementService settlementService,
            MatchQueryService matchQueryService,
            LastChairResponseMapper responseMapper
    ) {
        this.matchLifecycleService = matchLifecycleService;
        this.roundRevealService = roundRevealService;
        this.settlementService = settlementService;
        this.matchQueryService = matchQueryService;
        this.responseMapper = responseMapper;
    }

    @PostMapping("/{matchId}/start")
    public ResponseEntity<MatchResponses.MatchDetail> startMatch(
            @PathVariable Long matchId,
            @Valid @RequestBody MatchRequests.StartMatchRequest request
    ) {
        MatchLifecycleService.StartResult result = matchLifecycleService.startMatch(
                matchId,
                request.player(),
                request.stake(),
                request.commitments()
        );
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(responseMapper.toMatchDetailResponse(result.match()));
    }

    @PostMapping("/{matchId}/rounds/{roundNumber}/reveal")
    public ResponseEntity<MatchResponses.RoundDetail> submitReveal(
            @PathVariable Long matchId,
            @PathVariable int roundNumber,
            @Valid @RequestBody MatchRequests.RevealRequest request
    ) {
        return ResponseEntity.ok(responseMapper.toRoundDetailResponse(
                roundRevealService.submitReveal(matchId, roundNumber, request.player(), request.credential())
        ));
    }

    @PostMapping("/{matchId}/rounds/{roundNumber}/settle")
    public ResponseEntity<MatchResponses.RoundSettlement> settleRound(
            @PathVariable Long matchId,
            @PathVariable int roundNumber
    ) {
        return ResponseEntity.ok(responseMapper.toRoundSettlementResponse(
                settlementService.settleRound(matchId, roundNumber)
        ));
    }

    @PostMapping("/{matchId}/settle")
    public ResponseEntity<MatchResponses.MatchSettlement> settleMatch(@PathVariable Long matchId) {
        return ResponseEntity.ok(responseMapper.toMatchSettlementResponse(settlementService.settleMatch(matchId)));
    }

    @GetMapping("/{matchId}")
    public ResponseEntity<MatchResponses.MatchDetail> getMatch(@PathVariable Long matchId) {
        return ResponseEntity.ok(responseMapper.toMatchDetailResponse(matchQueryService.getMatch(matchId)));
    }

    @GetMapping("/{matchId}/rounds")
    public ResponseEntity<List<MatchResponses.RoundDetail>> listRounds(@PathVariable Long matchId) {
        return ResponseEntity.ok(responseMapper.toRoundDetailResponses(matchQueryService.listRounds(matchId)));
    }

    @GetMapping("/{matchId}/rounds/{roundNumber}")
    public ResponseEntity<MatchResponses.RoundDetail> getRound(
            @PathVariable Long matchId,
            @PathVariable int roundNumber
    ) {
        return ResponseEntity.ok(responseMapper.toRoundDetailResponse(matchQueryService.getRound(matchId, roundNumber)));
    }

    @GetMapping("/{matchId}/commitments/{player}/{roundNumber}")
    public ResponseEntity<MatchResponses.CommitmentDetail> getCommitment(
            @PathVariable Long matchId,
            @PathVariable String player,
            @PathVariable int roundNumber
    ) {
        return ResponseEntity.ok(responseMapper.toCommitmentDetailResponse(
                matchQueryService.getCommitment(matchId, player, roundNumber)
        ));
    }
}
