package org.crashgame.service.crash.util;

/**
 * Minuteries nommées de la boucle de jeu. Reprogrammer un nom annule la précédente,
 * et une minuterie annulée ou remplacée ne doit plus jamais s'exécuter.
 */
public interface Timeouts {

    void schedule(String name, long delayMs, Runnable task);

    void scheduleAtFixedRate(String name, long periodMs, Runnable task);

    void cancel(String name);

    void cancelAll();
}
