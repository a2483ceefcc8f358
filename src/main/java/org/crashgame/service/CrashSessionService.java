package org.crashgame.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crashgame.dto.crash.ClientMessage;
import org.crashgame.dto.crash.CrashEvent;
import org.crashgame.model.crash.CrashTable;
import org.crashgame.service.crash.CrashErrorCode;
import org.crashgame.service.crash.CrashException;
import org.crashgame.service.crash.broadcast.BroadcastHub;
import org.crashgame.service.crash.broadcast.EventSink;
import org.crashgame.service.crash.broadcast.UserQueueSink;
import org.crashgame.service.crash.ledger.SessionLedger;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Point d'entrée côté transport : connexion, arrivée sur la table, actions joueur.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrashSessionService {

    private final CrashTable table;
    private final SessionLedger ledger;
    private final BroadcastHub hub;
    private final ObjectMapper objectMapper;
    private final SimpMessagingTemplate broker;

    public void connect(String sessionId) {
        ledger.open(sessionId);
        log.info("Nouvel invité connecté : {}", sessionId);
    }

    public void disconnect(String sessionId) {
        synchronized (table) {
            hub.unsubscribe(sessionId);
            ledger.close(sessionId);
        }
        log.info("Invité déconnecté : {}", sessionId);
    }

    public void join(String sessionId) {
        try {
            join(sessionId, new UserQueueSink(broker, sessionId));
        } catch (CrashException ex) {
            log.debug("Join refusé pour {} : {}", sessionId, ex.getMessage());
            replyError(sessionId, ex.getCode(), ex.getMessage());
        }
    }

    /**
     * WELCOME puis rattrapage de l'état, sans qu'un tick ne s'intercale.
     * La session doit avoir été ouverte au CONNECT : un join traité après la déconnexion est refusé.
     */
    public void join(String sessionId, EventSink sink) {
        synchronized (table) {
            SessionLedger.SessionSnapshot s = ledger.view(sessionId);
            sink.deliver(CrashEvent.welcome(sessionId, s.balance(), table.getPhase(), table.getMultiplier()));
            hub.subscribe(sessionId, sink);
        }
    }

    /** Message brut du client ; toute erreur repart vers lui seul sous forme d'ERROR. */
    public void handle(String sessionId, String raw) {
        try {
            ClientMessage msg = parse(raw);
            switch (msg.getType()) {
                case ClientMessage.PLACE_BET -> ledger.placeBet(sessionId, msg.getAmount());
                case ClientMessage.CASHOUT -> ledger.cashOut(sessionId);
                default -> throw new CrashException(CrashErrorCode.MALFORMED_MESSAGE, "Unknown message type");
            }
        } catch (CrashException ex) {
            log.debug("{} refusé pour {} : {}", ex.getCode(), sessionId, ex.getMessage());
            replyError(sessionId, ex.getCode(), ex.getMessage());
        }
    }

    public void replyError(String sessionId, CrashErrorCode code, String message) {
        CrashEvent evt = CrashEvent.error(code.name(), message);
        // pas encore abonné (join non reçu) : on passe directement par la file utilisateur
        if (!hub.sendTo(sessionId, evt)) {
            broker.convertAndSendToUser(sessionId, UserQueueSink.DESTINATION, evt);
        }
    }

    private ClientMessage parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new CrashException(CrashErrorCode.MALFORMED_MESSAGE, "Empty message");
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            throw new CrashException(CrashErrorCode.MALFORMED_MESSAGE, "Malformed message", ex);
        }
        if (tree == null || !tree.isObject()) {
            throw new CrashException(CrashErrorCode.MALFORMED_MESSAGE, "Malformed message");
        }
        try {
            ClientMessage msg = objectMapper.treeToValue(tree, ClientMessage.class);
            if (msg == null || msg.getType() == null) {
                throw new CrashException(CrashErrorCode.MALFORMED_MESSAGE, "Missing message type");
            }
            return msg;
        } catch (MismatchedInputException ex) {
            // PLACE_BET bien formé mais montant illisible : c'est le montant qui est invalide
            if (ClientMessage.PLACE_BET.equals(tree.path("type").asText()) && isAmountField(ex)) {
                throw new CrashException(CrashErrorCode.INVALID_AMOUNT, "Invalid amount", ex);
            }
            throw new CrashException(CrashErrorCode.MALFORMED_MESSAGE, "Malformed message", ex);
        } catch (JsonProcessingException ex) {
            throw new CrashException(CrashErrorCode.MALFORMED_MESSAGE, "Malformed message", ex);
        }
    }

    private static boolean isAmountField(JsonMappingException ex) {
        List<JsonMappingException.Reference> path = ex.getPath();
        return !path.isEmpty() && "amount".equals(path.get(path.size() - 1).getFieldName());
    }
}
