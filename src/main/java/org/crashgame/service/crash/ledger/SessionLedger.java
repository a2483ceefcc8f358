package org.crashgame.service.crash.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crashgame.config.CrashProperties;
import org.crashgame.dto.crash.CrashEvent;
import org.crashgame.model.crash.CrashRound;
import org.crashgame.model.crash.CrashTable;
import org.crashgame.model.crash.GamePhase;
import org.crashgame.service.crash.CrashErrorCode;
import org.crashgame.service.crash.CrashException;
import org.crashgame.service.crash.broadcast.BroadcastHub;
import org.crashgame.service.crash.journal.RoundJournal;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Soldes et mises des sessions connectées : une mise par manche, un seul cashout par mise.
 * Toute mutation se fait sous le moniteur de {@link CrashTable}, le même que celui du moteur,
 * si bien qu'un cashout et la détection du crash ne peuvent pas s'entrelacer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLedger {

    public static final int MONEY_SCALE = 2;

    public record BetReceipt(BigDecimal amount, BigDecimal balance) {}
    public record CashoutReceipt(BigDecimal multiplier, BigDecimal win, BigDecimal balance) {}
    public record SessionSnapshot(String id, BigDecimal balance, BigDecimal activeBet, boolean cashedOut) {}
    public record Settlement(int lostBets, BigDecimal lostAmount, int cashedOut) {}

    private final CrashTable table;
    private final BroadcastHub hub;
    private final RoundJournal journal;
    private final CrashProperties props;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    // ---- cycle de vie des sessions ----

    public SessionSnapshot open(String sessionId) {
        synchronized (table) {
            Session s = sessions.computeIfAbsent(sessionId, id -> new Session(id, props.getStartingBalance()));
            return s.snapshot();
        }
    }

    public void close(String sessionId) {
        synchronized (table) {
            Session s = sessions.remove(sessionId);
            if (s != null && s.hasActiveBet() && !s.isCashedOut()) {
                log.info("{} déconnecté avec une mise de {} en jeu", sessionId, s.betAmount());
            }
        }
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int count() {
        return sessions.size();
    }

    public SessionSnapshot view(String sessionId) {
        synchronized (table) {
            return require(sessionId).snapshot();
        }
    }

    /** Vue admin, triée par id. */
    public Map<String, SessionSnapshot> snapshot() {
        synchronized (table) {
            Map<String, SessionSnapshot> out = new TreeMap<>();
            sessions.values().forEach(s -> out.put(s.id(), s.snapshot()));
            return out;
        }
    }

    // ---- actions joueur ----

    public BetReceipt placeBet(String sessionId, BigDecimal amount) {
        BigDecimal amt = validAmount(amount);
        synchronized (table) {
            Session s = require(sessionId);
            CrashRound round = table.getRound();
            if (table.getPhase() != GamePhase.WAITING || round == null) {
                throw new CrashException(CrashErrorCode.WRONG_PHASE, "Betting closed");
            }
            if (s.hasActiveBet()) {
                throw new CrashException(CrashErrorCode.DUPLICATE_BET, "Already bet");
            }
            if (s.balance().compareTo(amt) < 0) {
                throw new CrashException(CrashErrorCode.INSUFFICIENT_FUNDS, "Insufficient balance");
            }

            s.placeBet(amt);
            BetReceipt receipt = new BetReceipt(amt, s.balance());
            hub.sendTo(sessionId, CrashEvent.betConfirmed(receipt.amount(), receipt.balance()));
            journal.betPlaced(round.getId(), sessionId, amt, receipt.balance());
            log.debug("{} mise {} (solde {})", sessionId, amt, receipt.balance());
            return receipt;
        }
    }

    public CashoutReceipt cashOut(String sessionId) {
        synchronized (table) {
            Session s = require(sessionId);
            if (table.getPhase() != GamePhase.RUNNING) {
                throw new CrashException(CrashErrorCode.WRONG_PHASE, "Cashout closed");
            }
            if (!s.hasActiveBet() || s.isCashedOut()) {
                throw new CrashException(CrashErrorCode.NO_ACTIVE_BET, "No active bet");
            }

            BigDecimal multiplier = table.getMultiplier();
            BigDecimal win = s.cashOut(multiplier);
            CashoutReceipt receipt = new CashoutReceipt(multiplier, win, s.balance());
            hub.sendTo(sessionId, CrashEvent.cashoutConfirmed(multiplier, win, receipt.balance()));
            journal.cashedOut(table.getRound().getId(), sessionId, s.betAmount(), multiplier, win, receipt.balance());
            log.info("{} cashout x{} : +{}", sessionId, multiplier, win);
            return receipt;
        }
    }

    // ---- appelés par le moteur, verrou déjà pris ----

    public void resetBets() {
        synchronized (table) {
            sessions.values().forEach(Session::clearBet);
        }
    }

    /** Les mises non encaissées sont perdues ; déjà débitées, rien à retirer. */
    public Settlement settleCrash() {
        synchronized (table) {
            int lost = 0, won = 0;
            BigDecimal lostAmount = BigDecimal.ZERO.setScale(MONEY_SCALE);
            for (Session s : sessions.values()) {
                if (!s.hasActiveBet()) continue;
                if (s.isCashedOut()) {
                    won++;
                } else {
                    lost++;
                    lostAmount = lostAmount.add(s.betAmount());
                }
            }
            return new Settlement(lost, lostAmount, won);
        }
    }

    private Session require(String sessionId) {
        Session s = sessionId == null ? null : sessions.get(sessionId);
        if (s == null) throw new CrashException(CrashErrorCode.UNKNOWN_SESSION, "Unknown session");
        return s;
    }

    private static BigDecimal validAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new CrashException(CrashErrorCode.INVALID_AMOUNT, "Invalid amount");
        }
        if (amount.stripTrailingZeros().scale() > MONEY_SCALE) {
            throw new CrashException(CrashErrorCode.INVALID_AMOUNT, "Invalid amount");
        }
        return amount.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
    }
}
