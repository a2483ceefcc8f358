package org.crashgame.service.crash.fairness;

import org.crashgame.config.CrashProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Provably fair : le hash du seed serveur est publié avant la manche, le seed
 * lui-même après le crash. N'importe qui peut alors recalculer le crash point.
 */
@Service
public class FairnessCommitment {

    public record Commitment(String serverSeed, String serverSeedHash, String clientSeed, BigDecimal crashPoint) {}

    /** 13 chiffres hexa = 52 bits. */
    public static final int PREFIX_HEX_DIGITS = 13;
    public static final long TWO_POW_52 = 1L << 52;

    private static final int SEED_BYTES = 32;
    private static final BigDecimal MIN_CRASH = new BigDecimal("1.00");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SecureRandom random;
    private final BigDecimal edgeFactor;

    @Autowired
    public FairnessCommitment(CrashProperties props) {
        this(new SecureRandom(), props.getEdgeFactor());
    }

    public FairnessCommitment(SecureRandom random, BigDecimal edgeFactor) {
        if (edgeFactor == null || edgeFactor.signum() <= 0 || edgeFactor.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("edgeFactor doit être dans ]0, 1] : " + edgeFactor);
        }
        this.random = random;
        this.edgeFactor = edgeFactor;
    }

    public BigDecimal getEdgeFactor() {
        return edgeFactor;
    }

    public Commitment newRound(String clientSeed) {
        byte[] bytes = new byte[SEED_BYTES];
        random.nextBytes(bytes);
        String serverSeed = HexFormat.of().formatHex(bytes);
        return new Commitment(serverSeed, sha256Hex(serverSeed), clientSeed, crashPoint(serverSeed, clientSeed, edgeFactor));
    }

    public boolean verify(String serverSeed, String serverSeedHash, String clientSeed, BigDecimal crashPoint) {
        return verify(serverSeed, serverSeedHash, clientSeed, crashPoint, edgeFactor);
    }

    // ---- fonctions pures, utilisables par un auditeur sans le service ----

    public static boolean verify(String serverSeed, String serverSeedHash, String clientSeed,
                                 BigDecimal crashPoint, BigDecimal edgeFactor) {
        if (serverSeed == null || serverSeedHash == null || clientSeed == null || crashPoint == null) return false;
        // clé HMAC vide refusée par SecretKeySpec
        if (serverSeed.isEmpty()) return false;
        if (!sha256Hex(serverSeed).equalsIgnoreCase(serverSeedHash)) return false;
        return crashPoint(serverSeed, clientSeed, edgeFactor).compareTo(crashPoint) == 0;
    }

    public static String sha256Hex(String data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 indisponible", e);
        }
    }

    public static String hmacSha256Hex(String key, String message) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 indisponible", e);
        }
    }

    public static BigDecimal crashPoint(String serverSeed, String clientSeed, BigDecimal edgeFactor) {
        String mac = hmacSha256Hex(serverSeed, clientSeed);
        long x = Long.parseLong(mac.substring(0, PREFIX_HEX_DIGITS), 16);
        return crashPointFromPrefix(x, edgeFactor);
    }

    /**
     * max(1.00, floor(100 * edge * 2^52 / (2^52 - x)) / 100), en arithmétique exacte.
     */
    public static BigDecimal crashPointFromPrefix(long x, BigDecimal edgeFactor) {
        if (x < 0 || x >= TWO_POW_52) throw new IllegalArgumentException("Préfixe hors de [0, 2^52) : " + x);
        BigDecimal numerator = HUNDRED.multiply(edgeFactor).multiply(new BigDecimal(BigInteger.valueOf(TWO_POW_52)));
        BigDecimal cents = numerator.divide(BigDecimal.valueOf(TWO_POW_52 - x), 0, RoundingMode.FLOOR);
        BigDecimal value = cents.movePointLeft(2).setScale(2, RoundingMode.UNNECESSARY);
        return value.max(MIN_CRASH);
    }
}
