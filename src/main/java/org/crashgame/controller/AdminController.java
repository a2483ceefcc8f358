package org.crashgame.controller;

import lombok.RequiredArgsConstructor;
import org.crashgame.service.crash.broadcast.BroadcastHub;
import org.crashgame.service.crash.engine.RoundEngine;
import org.crashgame.service.crash.journal.RoundJournal;
import org.crashgame.service.crash.ledger.SessionLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** Lecture seule : sessions connectées et manche en cours, jamais le seed avant le crash. */
@RestController
@RequestMapping("/admin")
@PreAuthorize("hasRole('ADMIN')")
@RequiredArgsConstructor
public class AdminController {

    private final SessionLedger ledger;
    private final RoundEngine engine;
    private final BroadcastHub hub;
    private final RoundJournal journal;

    @GetMapping("/users")
    public ResponseEntity<?> users() {
        Map<String, Object> users = new LinkedHashMap<>();
        ledger.snapshot().forEach((id, s) -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("balance", s.balance());
            m.put("activeBet", s.activeBet());
            m.put("cashedOut", s.cashedOut());
            users.put(id, m);
        });
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active_users", users.size());
        body.put("users", users);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/round")
    public ResponseEntity<?> round() {
        RoundEngine.RoundView v = engine.view();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("roundId", v.roundId());
        body.put("phase", v.phase().name());
        body.put("multiplier", v.multiplier());
        body.put("remainingSeconds", v.remainingSeconds());
        body.put("serverSeedHash", v.serverSeedHash());
        body.put("clientSeed", v.clientSeed());
        body.put("startedAt", v.startedAt());
        body.put("subscribers", hub.subscriberCount());
        body.put("journalFailures", journal.failureCount());
        return ResponseEntity.ok(body);
    }
}
