package org.crashgame.model.crash;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * État vivant de la table de crash. L'instance sert aussi de moniteur unique :
 * phase, multiplicateur, manche et mises ne changent que sous {@code synchronized (table)}.
 */
@Getter
@Setter
public class CrashTable {
    public static final BigDecimal BASE_MULTIPLIER = new BigDecimal("1.00");

    private GamePhase phase = GamePhase.WAITING;
    private BigDecimal multiplier = BASE_MULTIPLIER;
    private int remainingSeconds = 0;
    private CrashRound round;
    private boolean started = false;
}
