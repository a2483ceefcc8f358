package org.crashgame.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.crashgame.dto.RoundSummaryDto;
import org.crashgame.dto.VerifyRequest;
import org.crashgame.dto.VerifyResponse;
import org.crashgame.model.BetRecord;
import org.crashgame.repo.BetRecordRepository;
import org.crashgame.repo.RoundRecordRepository;
import org.crashgame.service.crash.fairness.FairnessCommitment;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/crash")
@RequiredArgsConstructor
public class RoundController {

    private static final int MAX_LIMIT = 100;

    private final RoundRecordRepository rounds;
    private final BetRecordRepository bets;
    private final FairnessCommitment fairness;

    /** Dernières manches terminées, seeds révélés. */
    @GetMapping("/rounds")
    public List<RoundSummaryDto> recent(@RequestParam(defaultValue = "20") int limit) {
        int n = Math.max(1, Math.min(MAX_LIMIT, limit));
        return rounds.findByEndedAtIsNotNullOrderByStartedAtDesc(PageRequest.of(0, n)).stream()
                .map(RoundSummaryDto::of)
                .toList();
    }

    @GetMapping("/rounds/{id}/bets")
    public ResponseEntity<?> betsOf(@PathVariable String id) {
        var round = rounds.findById(id).filter(r -> r.getEndedAt() != null);
        if (round.isEmpty()) {
            return ResponseEntity.status(404).body(Map.of("error", "Manche inconnue ou en cours"));
        }
        List<BetRecord> list = bets.findByRoundIdOrderByIdAsc(id);
        return ResponseEntity.ok(list);
    }

    @PostMapping("/verify")
    public ResponseEntity<?> verify(@Valid @RequestBody VerifyRequest req, BindingResult binding) {
        if (binding.hasErrors()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Paramètres invalides"));
        }
        String expectedHash = FairnessCommitment.sha256Hex(req.getServerSeed());
        BigDecimal expected = FairnessCommitment.crashPoint(req.getServerSeed(), req.getClientSeed(), fairness.getEdgeFactor());
        boolean ok = fairness.verify(req.getServerSeed(), req.getServerSeedHash(), req.getClientSeed(), req.getCrashPoint());
        return ResponseEntity.ok(new VerifyResponse(ok, expectedHash, expected));
    }
}
