package org.crashgame.model.crash;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Manche en cours. Le seed serveur et le crash point restent privés :
 * la seule lecture possible passe par {@link #reveal()}, qui exige une manche close.
 */
public class CrashRound {

    public record Reveal(String serverSeed, BigDecimal crashPoint) {}

    @Getter private final String id;
    @Getter private final String serverSeedHash;
    @Getter private final String clientSeed;
    @Getter private final Instant startedAt;
    @Getter private Instant endedAt;

    private final String serverSeed;
    private final BigDecimal crashPoint;

    public CrashRound(String id, String serverSeed, String serverSeedHash, String clientSeed,
                      BigDecimal crashPoint, Instant startedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.serverSeed = Objects.requireNonNull(serverSeed, "serverSeed");
        this.serverSeedHash = Objects.requireNonNull(serverSeedHash, "serverSeedHash");
        this.clientSeed = Objects.requireNonNull(clientSeed, "clientSeed");
        this.crashPoint = Objects.requireNonNull(crashPoint, "crashPoint");
        this.startedAt = startedAt;
    }

    public boolean isCrashedAt(BigDecimal multiplier) {
        return multiplier.compareTo(crashPoint) >= 0;
    }

    /** Le multiplicateur affiché ne dépasse jamais le crash point. */
    public BigDecimal capAtCrash(BigDecimal multiplier) {
        return multiplier.min(crashPoint);
    }

    public boolean isClosed() {
        return endedAt != null;
    }

    public void close(Instant at) {
        if (endedAt != null) throw new IllegalStateException("Manche déjà close: " + id);
        this.endedAt = Objects.requireNonNull(at, "at");
    }

    public Reveal reveal() {
        if (endedAt == null) throw new IllegalStateException("Seed révélé avant le crash: " + id);
        return new Reveal(serverSeed, crashPoint);
    }
}
