package org.crashgame.dto;

import org.crashgame.model.RoundRecord;

import java.math.BigDecimal;
import java.time.Instant;

public record RoundSummaryDto(String id, String serverSeed, String serverSeedHash, String clientSeed,
                              BigDecimal crashPoint, Instant startedAt, Instant endedAt) {

    public static RoundSummaryDto of(RoundRecord r) {
        return new RoundSummaryDto(r.getId(), r.getServerSeed(), r.getServerSeedHash(), r.getClientSeed(),
                r.getCrashPoint(), r.getStartedAt(), r.getEndedAt());
    }
}
