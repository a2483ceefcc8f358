package org.crashgame.dto;

import java.math.BigDecimal;

public class VerifyResponse {
    public boolean valid;
    public String expectedHash;
    public BigDecimal expectedCrashPoint;

    public VerifyResponse(boolean valid, String expectedHash, BigDecimal expectedCrashPoint) {
        this.valid = valid;
        this.expectedHash = expectedHash;
        this.expectedCrashPoint = expectedCrashPoint;
    }
}
