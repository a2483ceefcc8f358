package org.crashgame.service.crash.journal;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.crashgame.config.CrashProperties;
import org.crashgame.model.BetRecord;
import org.crashgame.model.RoundRecord;
import org.crashgame.repo.BetRecordRepository;
import org.crashgame.repo.RoundRecordRepository;
import org.crashgame.service.crash.CrashErrorCode;
import org.crashgame.service.crash.fairness.FairnessCommitment.Commitment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * File de sortie vers la base. Les écritures partent sur un thread dédié, dans l'ordre
 * d'arrivée ; un échec est journalisé et compté, jamais remonté à la boucle de jeu.
 */
@Slf4j
@Service
public class RoundJournal {

    private final RoundRecordRepository rounds;
    private final BetRecordRepository bets;
    private final boolean enabled;
    private final Executor queue;
    private final AtomicLong failures = new AtomicLong();

    @Autowired
    public RoundJournal(RoundRecordRepository rounds, BetRecordRepository bets, CrashProperties props) {
        this(rounds, bets, props.getJournal().isEnabled(), Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "crash-journal");
            t.setDaemon(true);
            return t;
        }));
    }

    public RoundJournal(RoundRecordRepository rounds, BetRecordRepository bets, boolean enabled, Executor queue) {
        this.rounds = rounds;
        this.bets = bets;
        this.enabled = enabled;
        this.queue = queue;
    }

    public void roundOpened(String roundId, Commitment c, Instant startedAt) {
        submit("ouverture manche " + roundId, () -> rounds.save(RoundRecord.builder()
                .id(roundId)
                .serverSeed(c.serverSeed())
                .serverSeedHash(c.serverSeedHash())
                .clientSeed(c.clientSeed())
                .crashPoint(c.crashPoint())
                .startedAt(startedAt)
                .build()));
    }

    public void roundClosed(String roundId, Instant endedAt) {
        submit("clôture manche " + roundId, () -> {
            if (rounds.markEnded(roundId, endedAt) == 0) {
                throw new IllegalStateException("manche absente en base");
            }
        });
    }

    public void betPlaced(String roundId, String sessionId, BigDecimal amount, BigDecimal balanceAfter) {
        submit("mise " + sessionId, () -> bets.save(BetRecord.builder()
                .roundId(roundId)
                .sessionId(sessionId)
                .kind(BetRecord.Kind.BET)
                .amount(amount)
                .balanceDelta(amount.negate())
                .balanceAfter(balanceAfter)
                .build()));
    }

    public void cashedOut(String roundId, String sessionId, BigDecimal amount, BigDecimal multiplier,
                          BigDecimal win, BigDecimal balanceAfter) {
        submit("cashout " + sessionId, () -> bets.save(BetRecord.builder()
                .roundId(roundId)
                .sessionId(sessionId)
                .kind(BetRecord.Kind.CASHOUT)
                .amount(amount)
                .multiplier(multiplier)
                .balanceDelta(win)
                .balanceAfter(balanceAfter)
                .build()));
    }

    public long failureCount() {
        return failures.get();
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        if (queue instanceof ExecutorService es) {
            es.shutdown();
            if (!es.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Journal arrêté avec des écritures en attente");
                es.shutdownNow();
            }
        }
    }

    private void submit(String what, Runnable write) {
        if (!enabled) return;
        try {
            queue.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException ex) {
                    failures.incrementAndGet();
                    log.warn("[{}] {} : {}", CrashErrorCode.PERSISTENCE_UNAVAILABLE, what, ex.getMessage());
                }
            });
        } catch (RejectedExecutionException ex) {
            failures.incrementAndGet();
            log.warn("[{}] {} : journal fermé", CrashErrorCode.PERSISTENCE_UNAVAILABLE, what);
        }
    }
}
