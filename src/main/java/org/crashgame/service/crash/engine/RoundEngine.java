package org.crashgame.service.crash.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crashgame.config.CrashProperties;
import org.crashgame.dto.crash.CrashEvent;
import org.crashgame.model.crash.CrashRound;
import org.crashgame.model.crash.CrashTable;
import org.crashgame.model.crash.GamePhase;
import org.crashgame.service.crash.broadcast.BroadcastHub;
import org.crashgame.service.crash.fairness.FairnessCommitment;
import org.crashgame.service.crash.fairness.FairnessCommitment.Commitment;
import org.crashgame.service.crash.journal.RoundJournal;
import org.crashgame.service.crash.ledger.SessionLedger;
import org.crashgame.service.crash.util.Timeouts;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Boucle WAITING → RUNNING → CRASHED → WAITING, sans fin une fois lancée.
 * Chaque transition se fait sous le moniteur de la table ; chaque minuterie porte l'id de
 * sa manche et ne fait rien si la manche ou la phase ont changé entre-temps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundEngine {

    static final String COUNTDOWN = "countdown";
    static final String TICK = "tick";
    static final String NEXT_ROUND = "nextRound";
    private static final long COUNTDOWN_STEP_MS = 1_000;

    public record RoundView(String roundId, GamePhase phase, BigDecimal multiplier, int remainingSeconds,
                            String serverSeedHash, String clientSeed, Instant startedAt) {}

    private final CrashTable table;
    private final FairnessCommitment fairness;
    private final SessionLedger ledger;
    private final BroadcastHub hub;
    private final RoundJournal journal;
    private final Timeouts timeouts;
    private final CrashProperties props;

    public void start() {
        synchronized (table) {
            if (table.isStarted()) return;
            table.setStarted(true);
            log.info("Démarrage de la boucle de crash");
            startWaiting();
        }
    }

    public void stop() {
        synchronized (table) {
            table.setStarted(false);
            timeouts.cancelAll();
            log.info("Boucle de crash arrêtée");
        }
    }

    public RoundView view() {
        synchronized (table) {
            CrashRound r = table.getRound();
            return new RoundView(
                    r == null ? null : r.getId(),
                    table.getPhase(),
                    table.getMultiplier(),
                    table.getRemainingSeconds(),
                    r == null ? null : r.getServerSeedHash(),
                    r == null ? null : r.getClientSeed(),
                    r == null ? null : r.getStartedAt());
        }
    }

    // ---- WAITING ----

    void startWaiting() {
        timeouts.cancel(TICK);
        timeouts.cancel(NEXT_ROUND);
        ledger.resetBets();

        Commitment c = fairness.newRound(props.getClientSeed());
        CrashRound round = new CrashRound(UUID.randomUUID().toString(), c.serverSeed(), c.serverSeedHash(),
                c.clientSeed(), c.crashPoint(), Instant.now());
        table.setRound(round);
        table.setPhase(GamePhase.WAITING);
        table.setMultiplier(CrashTable.BASE_MULTIPLIER);
        table.setRemainingSeconds(props.getWaitingSeconds());

        // le hash part avant toute révélation ; l'écriture en base est asynchrone
        journal.roundOpened(round.getId(), c, round.getStartedAt());
        log.info("Manche {} : mises ouvertes, hash {}", round.getId(), round.getServerSeedHash());

        hub.publish(CrashEvent.state(GamePhase.WAITING));
        hub.publish(CrashEvent.roundStart(round.getServerSeedHash(), round.getClientSeed()));
        hub.publish(CrashEvent.waitingTick(table.getRemainingSeconds()));

        if (table.getRemainingSeconds() <= 0) {
            startRunning();
            return;
        }
        String roundId = round.getId();
        timeouts.scheduleAtFixedRate(COUNTDOWN, COUNTDOWN_STEP_MS, () -> onCountdownTick(roundId));
    }

    void onCountdownTick(String roundId) {
        synchronized (table) {
            if (!isCurrent(roundId, GamePhase.WAITING)) return;
            int left = table.getRemainingSeconds() - 1;
            table.setRemainingSeconds(Math.max(0, left));
            if (left > 0) {
                hub.publish(CrashEvent.waitingTick(left));
            } else {
                startRunning();
            }
        }
    }

    // ---- RUNNING ----

    private void startRunning() {
        timeouts.cancel(COUNTDOWN);
        CrashRound round = table.getRound();
        table.setPhase(GamePhase.RUNNING);
        table.setMultiplier(CrashTable.BASE_MULTIPLIER);
        table.setRemainingSeconds(0);
        hub.publish(CrashEvent.state(GamePhase.RUNNING));
        log.info("Manche {} : décollage", round.getId());

        // crash point à 1.00 : perte immédiate, aucun tick
        if (round.isCrashedAt(CrashTable.BASE_MULTIPLIER)) {
            crash();
            return;
        }
        String roundId = round.getId();
        timeouts.scheduleAtFixedRate(TICK, props.getTickMillis(), () -> onTick(roundId));
    }

    void onTick(String roundId) {
        synchronized (table) {
            if (!isCurrent(roundId, GamePhase.RUNNING)) return;
            CrashRound round = table.getRound();
            BigDecimal next = round.capAtCrash(table.getMultiplier().add(props.getMultiplierStep()))
                    .setScale(SessionLedger.MONEY_SCALE, RoundingMode.HALF_UP);
            table.setMultiplier(next);
            hub.publish(CrashEvent.multiplier(next));
            if (round.isCrashedAt(next)) crash();
        }
    }

    // ---- CRASHED ----

    private void crash() {
        timeouts.cancel(TICK);
        CrashRound round = table.getRound();
        table.setPhase(GamePhase.CRASHED);
        round.close(Instant.now());
        CrashRound.Reveal reveal = round.reveal();

        hub.publish(CrashEvent.state(GamePhase.CRASHED));
        hub.publish(CrashEvent.crash(reveal.crashPoint(), reveal.serverSeed()));

        SessionLedger.Settlement st = ledger.settleCrash();
        journal.roundClosed(round.getId(), round.getEndedAt());
        log.info("Manche {} : crash à x{} ({} mises perdues pour {}, {} encaissées)",
                round.getId(), reveal.crashPoint(), st.lostBets(), st.lostAmount(), st.cashedOut());

        String roundId = round.getId();
        timeouts.schedule(NEXT_ROUND, props.getCrashPauseMillis(), () -> onPauseOver(roundId));
    }

    void onPauseOver(String roundId) {
        synchronized (table) {
            if (!isCurrent(roundId, GamePhase.CRASHED)) return;
            startWaiting();
        }
    }

    private boolean isCurrent(String roundId, GamePhase phase) {
        CrashRound r = table.getRound();
        return table.isStarted() && r != null && r.getId().equals(roundId) && table.getPhase() == phase;
    }
}
