package org.crashgame.service.crash.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Solde et mise d'un joueur connecté. Modifiable uniquement par {@link SessionLedger},
 * sous le verrou de la table.
 */
class Session {
    private final String id;
    private BigDecimal balance;
    private BigDecimal betAmount;   // null = pas de mise cette manche
    private boolean cashedOut;

    Session(String id, BigDecimal balance) {
        this.id = id;
        this.balance = balance.setScale(SessionLedger.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    String id() { return id; }
    BigDecimal balance() { return balance; }
    boolean hasActiveBet() { return betAmount != null; }
    boolean isCashedOut() { return cashedOut; }
    BigDecimal betAmount() { return betAmount; }

    void placeBet(BigDecimal amount) {
        if (balance.compareTo(amount) < 0) throw new IllegalStateException("solde négatif");
        balance = balance.subtract(amount);
        betAmount = amount;
        cashedOut = false;
    }

    /** Crédite le gain et renvoie son montant. */
    BigDecimal cashOut(BigDecimal multiplier) {
        if (betAmount == null || cashedOut) throw new IllegalStateException("pas de mise active");
        BigDecimal win = betAmount.multiply(multiplier).setScale(SessionLedger.MONEY_SCALE, RoundingMode.HALF_UP);
        cashedOut = true;
        balance = balance.add(win);
        return win;
    }

    void clearBet() {
        betAmount = null;
        cashedOut = false;
    }

    SessionLedger.SessionSnapshot snapshot() {
        return new SessionLedger.SessionSnapshot(id, balance, betAmount, cashedOut);
    }
}
