package org.crashgame.controller;

import org.crashgame.model.crash.GamePhase;
import org.crashgame.service.crash.broadcast.BroadcastHub;
import org.crashgame.service.crash.engine.RoundEngine;
import org.crashgame.service.crash.journal.RoundJournal;
import org.crashgame.service.crash.ledger.SessionLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminControllerTest {

    @Mock
    private SessionLedger ledger;

    @Mock
    private RoundEngine engine;

    @Mock
    private BroadcastHub hub;

    @Mock
    private RoundJournal journal;

    @InjectMocks
    private AdminController controller;

    @Test
    @SuppressWarnings("unchecked")
    void users_shouldListSessionsWithCount() {
        Map<String, SessionLedger.SessionSnapshot> snap = new TreeMap<>();
        snap.put("Guest_000001", new SessionLedger.SessionSnapshot("Guest_000001", new BigDecimal("800.00"), new BigDecimal("200.00"), false));
        snap.put("Guest_000002", new SessionLedger.SessionSnapshot("Guest_000002", new BigDecimal("1000.00"), null, false));
        when(ledger.snapshot()).thenReturn(snap);

        ResponseEntity<?> res = controller.users();

        Map<String, Object> body = (Map<String, Object>) res.getBody();
        assertThat(body.get("active_users")).isEqualTo(2);
        Map<String, Map<String, Object>> users = (Map<String, Map<String, Object>>) body.get("users");
        assertThat(users).containsOnlyKeys("Guest_000001", "Guest_000002");
        assertThat((BigDecimal) users.get("Guest_000001").get("balance")).isEqualByComparingTo("800");
        assertThat(users.get("Guest_000002").get("activeBet")).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void round_shouldExposeHashButNoSeed() {
        when(engine.view()).thenReturn(new RoundEngine.RoundView("r1", GamePhase.RUNNING, new BigDecimal("1.42"), 0,
                "hash", "demo-client", Instant.now()));
        when(hub.subscriberCount()).thenReturn(3);
        when(journal.failureCount()).thenReturn(0L);

        ResponseEntity<?> res = controller.round();

        Map<String, Object> body = (Map<String, Object>) res.getBody();
        assertThat(body.get("phase")).isEqualTo("RUNNING");
        assertThat(body.get("serverSeedHash")).isEqualTo("hash");
        assertThat(body.get("subscribers")).isEqualTo(3);
        assertThat(body).doesNotContainKeys("serverSeed", "crashPoint");
    }
}
