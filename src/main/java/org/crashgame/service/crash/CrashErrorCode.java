package org.crashgame.service.crash;

public enum CrashErrorCode {
    WRONG_PHASE,
    DUPLICATE_BET,
    NO_ACTIVE_BET,
    INSUFFICIENT_FUNDS,
    INVALID_AMOUNT,
    PERSISTENCE_UNAVAILABLE,
    UNKNOWN_SESSION,
    MALFORMED_MESSAGE
}
