package org.crashgame.dto.crash;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.crashgame.model.crash.GamePhase;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message serveur → client. Sérialisé à plat : {"type":"MULTIPLIER","value":1.42}.
 */
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"type"})
public class CrashEvent {

    public static final String WELCOME = "WELCOME";
    public static final String STATE = "STATE";
    public static final String WAITING_TICK = "WAITING_TICK";
    public static final String ROUND_START = "ROUND_START";
    public static final String MULTIPLIER = "MULTIPLIER";
    public static final String BET_CONFIRMED = "BET_CONFIRMED";
    public static final String CASHOUT_CONFIRMED = "CASHOUT_CONFIRMED";
    public static final String CRASH = "CRASH";
    public static final String ERROR = "ERROR";

    @Getter
    private final String type;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private CrashEvent(String type) {
        this.type = type;
    }

    private CrashEvent with(String key, Object value) {
        fields.put(key, value);
        return this;
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public static CrashEvent welcome(String sessionId, BigDecimal balance, GamePhase phase, BigDecimal multiplier) {
        return new CrashEvent(WELCOME)
                .with("sessionId", sessionId)
                .with("balance", balance)
                .with("gameState", phase.name())
                .with("currentMultiplier", multiplier);
    }

    public static CrashEvent state(GamePhase phase) {
        return new CrashEvent(STATE).with("state", phase.name());
    }

    public static CrashEvent waitingTick(int seconds) {
        return new CrashEvent(WAITING_TICK).with("seconds", seconds);
    }

    public static CrashEvent roundStart(String serverSeedHash, String clientSeed) {
        return new CrashEvent(ROUND_START)
                .with("serverSeedHash", serverSeedHash)
                .with("clientSeed", clientSeed);
    }

    public static CrashEvent multiplier(BigDecimal value) {
        return new CrashEvent(MULTIPLIER).with("value", value);
    }

    public static CrashEvent betConfirmed(BigDecimal amount, BigDecimal balance) {
        return new CrashEvent(BET_CONFIRMED).with("amount", amount).with("balance", balance);
    }

    public static CrashEvent cashoutConfirmed(BigDecimal multiplier, BigDecimal win, BigDecimal balance) {
        return new CrashEvent(CASHOUT_CONFIRMED)
                .with("multiplier", multiplier)
                .with("win", win)
                .with("balance", balance);
    }

    public static CrashEvent crash(BigDecimal crashPoint, String serverSeed) {
        return new CrashEvent(CRASH).with("crashPoint", crashPoint).with("serverSeed", serverSeed);
    }

    public static CrashEvent error(String code, String message) {
        return new CrashEvent(ERROR).with("code", code).with("message", message);
    }
}
