package org.crashgame.service.crash;

import lombok.Getter;

/**
 * Erreur récupérable d'une action joueur, renvoyée au seul client concerné.
 */
@Getter
public class CrashException extends RuntimeException {
    private final CrashErrorCode code;

    public CrashException(CrashErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CrashException(CrashErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
