package org.crashgame.service.crash.broadcast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crashgame.dto.crash.CrashEvent;
import org.crashgame.model.crash.CrashRound;
import org.crashgame.model.crash.CrashTable;
import org.crashgame.model.crash.GamePhase;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diffusion des événements de manche à toutes les sessions connectées.
 * Un destinataire en erreur est ignoré, les autres sont servis normalement.
 * Les abonnés sont servis dans leur ordre d'inscription ; la table est gardée par le moniteur de {@link CrashTable}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastHub {

    private final CrashTable table;
    private final Map<String, EventSink> sinks = new LinkedHashMap<>();

    /** Enregistre la session et lui envoie tout de suite l'état courant de la table. */
    public void subscribe(String sessionId, EventSink sink) {
        synchronized (table) {
            // réabonnement : repasse en fin de file
            sinks.remove(sessionId);
            sinks.put(sessionId, sink);
            for (CrashEvent e : catchUp()) deliverSafely(sessionId, sink, e);
        }
    }

    public void unsubscribe(String sessionId) {
        synchronized (table) {
            sinks.remove(sessionId);
        }
    }

    public boolean isSubscribed(String sessionId) {
        synchronized (table) {
            return sinks.containsKey(sessionId);
        }
    }

    public int subscriberCount() {
        synchronized (table) {
            return sinks.size();
        }
    }

    public void publish(CrashEvent event) {
        synchronized (table) {
            for (Map.Entry<String, EventSink> e : sinks.entrySet()) {
                deliverSafely(e.getKey(), e.getValue(), event);
            }
        }
    }

    /** Réponse privée (confirmations, erreurs). */
    public boolean sendTo(String sessionId, CrashEvent event) {
        synchronized (table) {
            EventSink sink = sinks.get(sessionId);
            if (sink == null) {
                log.debug("{} non abonné, {} non envoyé", sessionId, event.getType());
                return false;
            }
            return deliverSafely(sessionId, sink, event);
        }
    }

    List<CrashEvent> catchUp() {
        List<CrashEvent> out = new ArrayList<>();
        GamePhase phase = table.getPhase();
        CrashRound round = table.getRound();
        out.add(CrashEvent.state(phase));
        if (round != null) out.add(CrashEvent.roundStart(round.getServerSeedHash(), round.getClientSeed()));
        switch (phase) {
            case WAITING -> out.add(CrashEvent.waitingTick(table.getRemainingSeconds()));
            case RUNNING -> out.add(CrashEvent.multiplier(table.getMultiplier()));
            case CRASHED -> {
                if (round != null && round.isClosed()) {
                    CrashRound.Reveal r = round.reveal();
                    out.add(CrashEvent.crash(r.crashPoint(), r.serverSeed()));
                }
            }
        }
        return out;
    }

    private boolean deliverSafely(String sessionId, EventSink sink, CrashEvent event) {
        try {
            sink.deliver(event);
            return true;
        } catch (RuntimeException ex) {
            log.warn("Envoi {} à {} impossible: {}", event.getType(), sessionId, ex.getMessage());
            return false;
        }
    }
}
