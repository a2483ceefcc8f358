package org.crashgame.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Réglages du jeu, préfixe {@code crash.*} dans application.properties.
 */
@Data
@ConfigurationProperties(prefix = "crash")
public class CrashProperties {

    /** Seed client partagée, publiée avec le hash au début de chaque manche. */
    private String clientSeed = "demo-client";

    /** 1 = distribution équitable, &lt; 1 = avantage maison (0.96 = 4%). */
    private BigDecimal edgeFactor = new BigDecimal("0.96");

    private int waitingSeconds = 5;
    private long tickMillis = 100;
    private BigDecimal multiplierStep = new BigDecimal("0.01");
    private long crashPauseMillis = 3_000;

    private BigDecimal startingBalance = new BigDecimal("1000");

    /** false dans les tests : la boucle n'est pas lancée au démarrage. */
    private boolean autoStart = true;

    private Journal journal = new Journal();
    private Admin admin = new Admin();

    @Data
    public static class Journal {
        private boolean enabled = true;
    }

    @Data
    public static class Admin {
        private String username = "admin";
        private String password = "admin";
    }
}
